package minikv.commands.list;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class LLenCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        client.sendInteger(client.getContext().getDatabase().llen(Args.str(args.get(1))));
    }
}
