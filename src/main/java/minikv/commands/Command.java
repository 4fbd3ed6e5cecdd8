package minikv.commands;

import minikv.network.ClientHandler;

import java.util.List;

public interface Command {
    // Executes the command logic; args.get(0) is the verb.
    // The command is responsible for sending its reply through the client.
    void execute(ClientHandler client, List<byte[]> args);
}
