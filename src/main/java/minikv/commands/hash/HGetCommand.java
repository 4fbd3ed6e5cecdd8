package minikv.commands.hash;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class HGetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        String field = Args.str(args.get(2));
        client.sendBulkString(client.getContext().getDatabase().hget(key, field));
    }
}
