package minikv.commands.generic;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.commands.CommandException;
import minikv.network.ClientHandler;

import java.util.List;

/**
 * EXPIRE (seconds) and PEXPIRE (milliseconds). A non-positive TTL deletes the key.
 */
public class ExpireCommand implements Command {
    private final long unitMillis;

    public ExpireCommand(long unitMillis) {
        this.unitMillis = unitMillis;
    }

    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        long amount = Args.parseLong(args.get(2));
        long ttlMillis;
        try {
            ttlMillis = Math.multiplyExact(amount, unitMillis);
        } catch (ArithmeticException e) {
            throw new CommandException("ERR invalid expire time in '" + Args.text(args.get(0)).toLowerCase() + "' command");
        }
        boolean applied = client.getContext().getDatabase().expire(key, ttlMillis);
        client.sendInteger(applied ? 1 : 0);
    }
}
