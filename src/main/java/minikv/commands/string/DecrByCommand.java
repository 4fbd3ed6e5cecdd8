package minikv.commands.string;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.commands.CommandException;
import minikv.network.ClientHandler;

import java.util.List;

public class DecrByCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        long delta = Args.parseLong(args.get(2));
        if (delta == Long.MIN_VALUE) {
            throw new CommandException("ERR decrement would overflow");
        }
        client.sendInteger(client.getContext().getDatabase().incrBy(key, -delta));
    }
}
