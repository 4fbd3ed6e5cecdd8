package minikv.commands.hash;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class HLenCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        client.sendInteger(client.getContext().getDatabase().hlen(Args.str(args.get(1))));
    }
}
