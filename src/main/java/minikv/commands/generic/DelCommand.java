package minikv.commands.generic;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.db.Database;
import minikv.network.ClientHandler;

import java.util.List;

public class DelCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        Database db = client.getContext().getDatabase();
        int deleted = 0;
        for (int i = 1; i < args.size(); i++) {
            if (db.delete(Args.str(args.get(i)))) deleted++;
        }
        client.sendInteger(deleted);
    }
}
