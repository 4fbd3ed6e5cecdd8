package minikv.commands.list;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class LIndexCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        long index = Args.parseLong(args.get(2));
        client.sendBulkString(client.getContext().getDatabase().lindex(key, index));
    }
}
