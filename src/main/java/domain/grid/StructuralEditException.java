package domain.grid;

/**
 * Raised when the backing store rejects a row/column insertion.
 *
 * <p>Fatal to the operation that triggered the growth; never retried.</p>
 */
public class StructuralEditException extends RuntimeException {

    public StructuralEditException(String message) {
        super(message);
    }
}
