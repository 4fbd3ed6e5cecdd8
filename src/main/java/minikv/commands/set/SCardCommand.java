package minikv.commands.set;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class SCardCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        client.sendInteger(client.getContext().getDatabase().scard(Args.str(args.get(1))));
    }
}
