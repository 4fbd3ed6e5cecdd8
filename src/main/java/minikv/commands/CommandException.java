package minikv.commands;

/**
 * A request that cannot be executed as given. The message is the full error reply.
 */
public class CommandException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public static final String SYNTAX = "ERR syntax error";
    public static final String NOT_AN_INTEGER = "ERR value is not an integer or out of range";
    public static final String NOT_A_FLOAT = "ERR value is not a valid float";

    public CommandException(String message) {
        super(message);
    }

    public static CommandException arity(String verb) {
        return new CommandException("ERR wrong number of arguments for '" + verb.toLowerCase() + "' command");
    }

    public static CommandException unknownCommand(String verb) {
        return new CommandException("ERR unknown command '" + verb + "'");
    }

    public static CommandException syntax() {
        return new CommandException(SYNTAX);
    }
}
