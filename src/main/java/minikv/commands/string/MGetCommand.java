package minikv.commands.string;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class MGetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        List<byte[]> values = client.getContext().getDatabase().mget(Args.strings(args, 1));
        client.sendArray(values);
    }
}
