package im.arun.treeinterval.error;

public class MalformedStatementException extends TreeIntervalException {

    public MalformedStatementException(String message) {
        super(message);
    }
}
