package minikv.commands.generic;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class PersistCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        boolean cleared = client.getContext().getDatabase().persist(Args.str(args.get(1)));
        client.sendInteger(cleared ? 1 : 0);
    }
}
