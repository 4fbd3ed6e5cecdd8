package minikv.commands.pubsub;

import minikv.PubSub;
import minikv.commands.Args;
import minikv.commands.Command;
import minikv.commands.CommandException;
import minikv.network.ClientHandler;
import minikv.protocol.RespArray;
import minikv.protocol.RespBulkString;
import minikv.protocol.RespFrame;
import minikv.protocol.RespInteger;
import minikv.utils.GlobMatcher;

import java.util.ArrayList;
import java.util.List;

/**
 * PUBSUB CHANNELS [pattern] | NUMSUB [channel ...] | NUMPAT
 */
public class PubSubCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        PubSub pubSub = client.getContext().getPubSub();
        String sub = Args.str(args.get(1)).toUpperCase();

        if (sub.equals("CHANNELS") && args.size() <= 3) {
            GlobMatcher filter = args.size() == 3 ? new GlobMatcher(Args.str(args.get(2))) : null;
            client.sendStringArray(pubSub.getChannels(filter));
        } else if (sub.equals("NUMSUB")) {
            List<RespFrame> result = new ArrayList<>();
            for (int i = 2; i < args.size(); i++) {
                String ch = Args.str(args.get(i));
                result.add(RespBulkString.of(ch));
                result.add(RespInteger.of(pubSub.getNumSub(ch)));
            }
            client.send(new RespArray(result));
        } else if (sub.equals("NUMPAT") && args.size() == 2) {
            client.sendInteger(pubSub.getPatternCount());
        } else {
            throw new CommandException("ERR Unknown PUBSUB subcommand or wrong number of arguments for '"
                    + Args.text(args.get(1)) + "'");
        }
    }
}
