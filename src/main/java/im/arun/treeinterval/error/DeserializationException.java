package im.arun.treeinterval.error;

/**
 * The external representation could not be decoded into a valid tree. The whole
 * document is rejected.
 */
public class DeserializationException extends TreeIntervalException {

    public DeserializationException(String message) {
        super(message);
    }

    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
