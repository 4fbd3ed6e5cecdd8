package minikv.commands.pubsub;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class PUnsubscribeCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        List<String> patterns = args.size() > 1
                ? Args.strings(args, 1)
                : client.getContext().getPubSub().getSubscribedPatterns(client);
        if (patterns.isEmpty()) {
            SubscriptionReplies.confirm(client, "punsubscribe", null);
            return;
        }
        for (String pattern : patterns) {
            client.getContext().getPubSub().punsubscribe(pattern, client);
            SubscriptionReplies.confirm(client, "punsubscribe", pattern);
        }
    }
}
