package minikv.commands.set;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class SRemCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        client.sendInteger(client.getContext().getDatabase().srem(key, Args.strings(args, 2)));
    }
}
