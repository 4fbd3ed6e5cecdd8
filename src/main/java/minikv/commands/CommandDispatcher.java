package minikv.commands;

import minikv.db.StoreException;
import minikv.network.ClientHandler;
import minikv.protocol.RespArray;
import minikv.protocol.RespBulkString;
import minikv.protocol.RespFrame;
import minikv.utils.Log;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates one request frame, runs the matching command and turns failures into error replies.
 */
public class CommandDispatcher {
    public static final String NOT_A_COMMAND = "ERR Protocol error: expected array of bulk strings";

    private final CommandRegistry registry;

    public CommandDispatcher(CommandRegistry registry) {
        this.registry = registry;
    }

    public CommandRegistry getRegistry() {
        return registry;
    }

    public void dispatch(ClientHandler client, RespFrame frame) {
        List<byte[]> args = toArgs(frame);
        if (args == null) {
            client.sendError(NOT_A_COMMAND);
            return;
        }
        if (args.isEmpty()) return;
        dispatch(client, args);
    }

    public void dispatch(ClientHandler client, List<byte[]> args) {
        String verb = Args.str(args.get(0));
        CommandContainer container = registry.get(verb);
        try {
            if (container == null) {
                throw CommandException.unknownCommand(Args.text(args.get(0)));
            }
            CommandMetadata meta = container.getMetadata();
            if (!meta.acceptsArgCount(args.size())) {
                throw CommandException.arity(verb);
            }
            if (client.isSubscribed() && !meta.hasFlag(CommandMetadata.FLAG_PUBSUB_CONTEXT)) {
                throw new CommandException("ERR Can't execute '" + verb.toLowerCase()
                        + "': only (P)SUBSCRIBE / (P)UNSUBSCRIBE / PING / QUIT are allowed in this context");
            }
            client.getContext().getTotalCommands().incrementAndGet();
            container.getCommand().execute(client, args);
        } catch (CommandException | StoreException e) {
            client.sendError(e.getMessage());
        } catch (RuntimeException e) {
            Log.error("Command " + verb + " failed for client " + client.getId(), e);
            client.sendError("ERR " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
    }

    /**
     * @return the request's arguments, or null when the frame is not an array of non-null bulk strings
     */
    static List<byte[]> toArgs(RespFrame frame) {
        if (!(frame instanceof RespArray)) return null;
        RespArray array = (RespArray) frame;
        if (array.isNull()) return null;
        List<byte[]> args = new ArrayList<>(array.size());
        for (RespFrame element : array.getElements()) {
            if (!(element instanceof RespBulkString)) return null;
            RespBulkString bulk = (RespBulkString) element;
            if (bulk.isNull()) return null;
            args.add(bulk.getContent());
        }
        return args;
    }
}
