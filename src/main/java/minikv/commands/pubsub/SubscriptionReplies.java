package minikv.commands.pubsub;

import minikv.network.ClientHandler;
import minikv.protocol.RespArray;
import minikv.protocol.RespBulkString;
import minikv.protocol.RespInteger;

final class SubscriptionReplies {
    private SubscriptionReplies() {
    }

    /**
     * {@code [kind, name, count]} where count is the session's remaining channels plus patterns.
     */
    static void confirm(ClientHandler client, String kind, String name) {
        int count = client.getContext().getPubSub().subscriptionCount(client);
        client.send(RespArray.of(RespBulkString.of(kind), RespBulkString.of(name), RespInteger.of(count)));
    }
}
