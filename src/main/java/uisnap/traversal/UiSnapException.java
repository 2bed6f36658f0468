package uisnap.traversal;

/**
 * Unchecked exception thrown by traversal and orchestration components when an
 * operation cannot be started or completed.
 */
public class UiSnapException extends RuntimeException {

    public UiSnapException(String msg) {
        super(msg);
    }

    public UiSnapException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
