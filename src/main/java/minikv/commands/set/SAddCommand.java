package minikv.commands.set;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class SAddCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        client.sendInteger(client.getContext().getDatabase().sadd(key, Args.strings(args, 2)));
    }
}
