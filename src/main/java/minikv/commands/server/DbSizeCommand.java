package minikv.commands.server;

import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class DbSizeCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        client.sendInteger(client.getContext().getDatabase().size());
    }
}
