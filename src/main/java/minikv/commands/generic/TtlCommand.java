package minikv.commands.generic;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

/**
 * TTL (seconds, rounded) and PTTL (milliseconds). -2 for a missing key, -1 without expiry.
 */
public class TtlCommand implements Command {
    private final boolean millis;

    public TtlCommand(boolean millis) {
        this.millis = millis;
    }

    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        long ttl = client.getContext().getDatabase().ttlMillis(Args.str(args.get(1)));
        if (ttl < 0 || millis) {
            client.sendInteger(ttl);
        } else {
            client.sendInteger((ttl + 500) / 1000);
        }
    }
}
