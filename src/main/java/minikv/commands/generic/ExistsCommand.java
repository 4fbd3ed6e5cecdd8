package minikv.commands.generic;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.db.Database;
import minikv.network.ClientHandler;

import java.util.List;

/**
 * Counts every argument that names a live key; repeated keys count repeatedly.
 */
public class ExistsCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        Database db = client.getContext().getDatabase();
        int count = 0;
        for (int i = 1; i < args.size(); i++) {
            if (db.exists(Args.str(args.get(i)))) count++;
        }
        client.sendInteger(count);
    }
}
