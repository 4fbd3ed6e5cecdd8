package minikv.commands.connection;

import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class EchoCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        client.sendBulkString(args.get(1));
    }
}
