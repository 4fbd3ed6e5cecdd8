package minikv.commands.pubsub;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class PSubscribeCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        for (int i = 1; i < args.size(); i++) {
            String pattern = Args.str(args.get(i));
            client.getContext().getPubSub().psubscribe(pattern, client);
            SubscriptionReplies.confirm(client, "psubscribe", pattern);
        }
    }
}
