package minikv.commands.zset;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class ZRankCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        Long rank = client.getContext().getDatabase().zrank(key, Args.str(args.get(2)));
        if (rank == null) {
            client.sendNull();
        } else {
            client.sendInteger(rank);
        }
    }
}
