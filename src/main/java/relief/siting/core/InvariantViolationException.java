package relief.siting.core;

/**
 * Raised when a value that the scorer contract guarantees to be a finite, non-negative
 * number reaches a budget accumulator in another shape. Any partial result is discarded.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
