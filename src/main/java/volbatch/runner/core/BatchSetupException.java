package volbatch.runner.core;

/**
 * A batch cannot start: missing settings, unreadable job list or unusable output directory.
 */
public class BatchSetupException extends Exception {

    private static final long serialVersionUID = 1L;

    public BatchSetupException(String message) {
        super(message);
    }

    public BatchSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
