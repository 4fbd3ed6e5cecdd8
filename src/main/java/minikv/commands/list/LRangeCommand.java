package minikv.commands.list;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

/**
 * LRANGE key start stop, inclusive; negative indexes count from the tail.
 */
public class LRangeCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        long start = Args.parseLong(args.get(2));
        long stop = Args.parseLong(args.get(3));
        client.sendStringArray(client.getContext().getDatabase().range(key, start, stop));
    }
}
