package minikv.commands.list;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class LPushCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        int size = client.getContext().getDatabase().push(key, true, Args.strings(args, 2));
        client.sendInteger(size);
    }
}
