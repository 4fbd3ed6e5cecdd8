package minikv.commands.string;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class SetNxCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        boolean set = client.getContext().getDatabase().setNx(key, args.get(2));
        client.sendInteger(set ? 1 : 0);
    }
}
