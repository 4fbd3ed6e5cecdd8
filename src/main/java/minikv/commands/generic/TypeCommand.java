package minikv.commands.generic;

import minikv.commands.Args;
import minikv.commands.Command;
import minikv.db.DataType;
import minikv.network.ClientHandler;

import java.util.List;

public class TypeCommand implements Command {
    @Override
    public void execute(ClientHandler client, List<byte[]> args) {
        DataType type = client.getContext().getDatabase().type(Args.str(args.get(1)));
        client.sendSimpleString(type == null ? "none" : type.typeName());
    }
}
