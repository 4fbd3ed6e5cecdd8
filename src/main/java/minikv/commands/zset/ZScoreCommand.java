package minikv.commands.zset;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class ZScoreCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String key = Args.str(args.get(1));
        Double score = client.getContext().getDatabase().zscore(key, Args.str(args.get(2)));
        client.sendBulkString(score == null ? null : Args.formatDouble(score));
    }
}
