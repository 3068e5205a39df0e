package front.migrator.app.service;

/**
 * Gmail labels required by the run could not be created or verified. Aborts the run.
 */
public class LabelReconciliationException extends RuntimeException {
    public LabelReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
