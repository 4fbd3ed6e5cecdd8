package minikv.commands.connection;

import minikv.commands.Command;
import minikv.network.ClientHandler;

import java.util.List;

public class QuitCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        client.sendOk();
        client.close("client sent QUIT");
    }
}
