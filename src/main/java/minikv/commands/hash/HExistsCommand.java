package minikv.commands.hash;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class HExistsCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        boolean exists = client.getContext().getDatabase().hexists(key, Args.str(args.get(2)));
        client.sendInteger(exists ? 1 : 0);
    }
}
