package minikv.commands.generic;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;
import minikv.utils.GlobMatcher;

import java.util.List;

public class KeysCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        GlobMatcher matcher = new GlobMatcher(Args.str(args.get(1)));
        client.sendStringArray(client.getContext().getDatabase().keys(matcher));
    }
}
