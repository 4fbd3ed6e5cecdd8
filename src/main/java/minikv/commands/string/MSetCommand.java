package minikv.commands.string;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.commands.CommandException;
import minikv.network.ClientHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MSetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        if ((args.size() - 1) % 2 != 0) {
            throw CommandException.arity("MSET");
        }
        Map<String, byte[]> pairs = new LinkedHashMap<>();
        for (int i = 1; i < args.size(); i += 2) {
            pairs.put(Args.str(args.get(i)), args.get(i + 1));
        }
        client.getContext().getDatabase().mset(pairs);
        client.sendOk();
    }
}
