package minikv.commands.pubsub;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class PublishCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        String channel = Args.str(args.get(1));
        int receivers = client.getContext().getPubSub().publish(channel, args.get(2));
        client.sendInteger(receivers);
    }
}
