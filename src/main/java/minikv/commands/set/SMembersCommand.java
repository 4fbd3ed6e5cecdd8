package minikv.commands.set;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class SMembersCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        client.sendStringArray(client.getContext().getDatabase().smembers(Args.str(args.get(1))));
    }
}
