package minikv.commands.zset;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.commands.CommandException;
import minikv.network.ClientHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ZADD key score member [score member ...]
 */
public class ZAddCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        if ((args.size() - 2) % 2 != 0) {
            throw CommandException.syntax();
        }
        String key = Args.str(args.get(1));
        // Parse every score before touching the key
        Map<String, Double> scores = new LinkedHashMap<>();
        for (int i = 2; i < args.size(); i += 2) {
            double score = Args.parseDouble(args.get(i));
            scores.put(Args.str(args.get(i + 1)), score);
        }
        client.sendInteger(client.getContext().getDatabase().zadd(key, scores));
    }
}
