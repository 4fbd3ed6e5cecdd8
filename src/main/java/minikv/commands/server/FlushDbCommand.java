package minikv.commands.server;

import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class FlushDbCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        client.getContext().getDatabase().flush();
        client.sendOk();
    }
}
