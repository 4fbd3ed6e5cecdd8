package minikv.commands.hash;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.commands.CommandException;
import minikv.network.ClientHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HSET key field value [field value ...]
 */
public class HSetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        if ((args.size() - 2) % 2 != 0) {
            throw CommandException.arity("HSET");
        }
        String key = Args.str(args.get(1));
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 2; i < args.size(); i += 2) {
            fields.put(Args.str(args.get(i)), Args.str(args.get(i + 1)));
        }
        client.sendInteger(client.getContext().getDatabase().hset(key, fields));
    }
}
