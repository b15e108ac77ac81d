package im.arun.treeinterval.error;

/**
 * Base type for structural failures raised by the interval tree.
 */
public class TreeIntervalException extends RuntimeException {

    public TreeIntervalException(String message) {
        super(message);
    }

    public TreeIntervalException(String message, Throwable cause) {
        super(message, cause);
    }
}
