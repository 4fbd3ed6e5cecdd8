package minikv.commands.list;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class RPushCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        int size = client.getContext().getDatabase().push(key, false, Args.strings(args, 2));
        client.sendInteger(size);
    }
}
