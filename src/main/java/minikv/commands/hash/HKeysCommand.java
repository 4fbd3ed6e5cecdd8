package minikv.commands.hash;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class HKeysCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        client.sendStringArray(client.getContext().getDatabase().hkeys(Args.str(args.get(1))));
    }
}
