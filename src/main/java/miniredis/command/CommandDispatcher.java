package miniredis.command;

import miniredis.datastore.KeyValueStore;
import miniredis.error.InvalidArgumentsException;
import miniredis.error.InvalidCommandException;
import miniredis.error.MiniRedisException;
import miniredis.parser.Request;

/**
 * Runs a parsed request against the store and returns the response payload.
 * Never touches the connection; the caller decides how a result or an error is written.
 */
public class CommandDispatcher {

    static final String OK = "OK";
    static final String NIL = "nil";

    private final KeyValueStore store;

    public CommandDispatcher(KeyValueStore store) {
        this.store = store;
    }

    public String dispatch(Request request) throws MiniRedisException {
        Command command = Command.lookup(request.command())
                .orElseThrow(() -> new InvalidCommandException(request.command()));

        if (request.arity() != command.arity()) {
            throw new InvalidArgumentsException(request.arguments());
        }

        return switch (command) {
            case GET -> store.get(request.argument(0)).orElse(NIL);
            case SET -> {
                store.set(request.argument(0), request.argument(1));
                yield OK;
            }
            case DEL -> {
                store.delete(request.argument(0));
                yield OK;
            }
        };
    }
}
