package minikv.commands.pubsub;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

/**
 * UNSUBSCRIBE [channel ...]; without arguments drops every channel subscription.
 */
public class UnsubscribeCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        List<String> channels = args.size() > 1
                ? Args.strings(args, 1)
                : client.getContext().getPubSub().getSubscribedChannels(client);
        if (channels.isEmpty()) {
            SubscriptionReplies.confirm(client, "unsubscribe", null);
            return;
        }
        for (String channel : channels) {
            client.getContext().getPubSub().unsubscribe(channel, client);
            SubscriptionReplies.confirm(client, "unsubscribe", channel);
        }
    }
}
