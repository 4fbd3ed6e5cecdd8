package minikv.commands.string;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.commands.CommandException;
import minikv.db.ValueEntry;
import minikv.network.ClientHandler;

import java.util.List;

/**
 * SET key value [EX seconds | PX milliseconds] [NX | XX]
 */
public class SetCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        byte[] val = args.get(2);

        long ttlMillis = -1;
        boolean nx = false;
        boolean xx = false;

        // Parse options
        for (int i = 3; i < args.size(); i++) {
            String arg = Args.str(args.get(i)).toUpperCase();
            if ((arg.equals("EX") || arg.equals("PX")) && i + 1 < args.size() && ttlMillis == -1) {
                long amount = Args.parseLong(args.get(++i));
                if (amount <= 0) {
                    throw new CommandException("ERR invalid expire time in 'set' command");
                }
                try {
                    ttlMillis = arg.equals("EX") ? Math.multiplyExact(amount, 1000L) : amount;
                } catch (ArithmeticException e) {
                    throw new CommandException("ERR invalid expire time in 'set' command");
                }
            } else if (arg.equals("NX") && !xx) {
                nx = true;
            } else if (arg.equals("XX") && !nx) {
                xx = true;
            } else {
                throw CommandException.syntax();
            }
        }

        long expireAt = ValueEntry.NO_EXPIRY;
        if (ttlMillis != -1) {
            long now = client.getContext().getClock().currentTimeMillis();
            expireAt = ttlMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis;
        }

        if (client.getContext().getDatabase().set(key, val, expireAt, nx, xx)) {
            client.sendOk();
        } else {
            client.sendNull();
        }
    }
}
