package minikv.commands.connection;

import minikv.commands.Command;
import minikv.commands.CommandException;
import minikv.network.ClientHandler;
import minikv.protocol.RespArray;
import minikv.protocol.RespBulkString;

import java.util.List;

/**
 * PING [message]. In subscribed mode the reply takes the push shape {@code ["pong", message]}.
 */
public class PingCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        if (args.size() > 2) {
            throw CommandException.arity("PING");
        }
        byte[] message = args.size() == 2 ? args.get(1) : null;
        if (client.isSubscribed()) {
            client.send(RespArray.of(RespBulkString.of("pong"),
                    message == null ? RespBulkString.of("") : RespBulkString.of(message)));
        } else if (message == null) {
            client.sendSimpleString("PONG");
        } else {
            client.sendBulkString(message);
        }
    }
}
