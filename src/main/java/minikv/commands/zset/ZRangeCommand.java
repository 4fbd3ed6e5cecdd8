package minikv.commands.zset;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.commands.CommandException;
import minikv.network.ClientHandler;
import minikv.structs.ZNode;

import java.util.ArrayList;
import java.util.List;

/**
 * ZRANGE key start stop [WITHSCORES]
 */
public class ZRangeCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        long start = Args.parseLong(args.get(2));
        long stop = Args.parseLong(args.get(3));
        boolean withScores = false;
        if (args.size() == 5 && Args.str(args.get(4)).equalsIgnoreCase("WITHSCORES")) {
            withScores = true;
        } else if (args.size() > 4) {
            throw CommandException.syntax();
        }

        List<ZNode> nodes = client.getContext().getDatabase().zrange(key, start, stop);
        List<String> reply = new ArrayList<>(withScores ? nodes.size() * 2 : nodes.size());
        for (ZNode node : nodes) {
            reply.add(node.member);
            if (withScores) reply.add(Args.formatDouble(node.score));
        }
        client.sendStringArray(reply);
    }
}
