package minikv.commands.set;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class SIsMemberCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        boolean member = client.getContext().getDatabase().sismember(key, Args.str(args.get(2)));
        client.sendInteger(member ? 1 : 0);
    }
}
