package minikv.commands.hash;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replies with a flat field, value, field, value ... array.
 */
public class HGetAllCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        Map<String, String> hash = client.getContext().getDatabase().hgetAll(Args.str(args.get(1)));
        List<String> flat = new ArrayList<>(hash.size() * 2);
        for (Map.Entry<String, String> e : hash.entrySet()) {
            flat.add(e.getKey());
            flat.add(e.getValue());
        }
        client.sendStringArray(flat);
    }
}
