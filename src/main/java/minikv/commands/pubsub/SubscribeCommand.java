package minikv.commands.pubsub;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class SubscribeCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        for (int i = 1; i < args.size(); i++) {
            String channel = Args.str(args.get(i));
            client.getContext().getPubSub().subscribe(channel, client);
            SubscriptionReplies.confirm(client, "subscribe", channel);
        }
    }
}
