package uisnap.traversal;

/**
 * The root handle given to a traversal was null or otherwise unusable. This is a caller
 * error, distinct from a traversal that simply found nothing (an empty snapshot).
 */
public class InvalidRootException extends UiSnapException {

    public InvalidRootException(String msg) {
        super(msg);
    }
}
