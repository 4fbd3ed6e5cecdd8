package minikv.commands.string;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class GetSetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        client.sendBulkString(client.getContext().getDatabase().getSet(key, args.get(2)));
    }
}
