package works.docsink.exceptions;

/**
 * Indicates that a change event has no identifier usable for a keyed operation.
 */
public class InvalidIdentifierException extends Exception {
	public InvalidIdentifierException(String message) {
		super(message);
	}

	public InvalidIdentifierException(String message, Throwable cause) {
		super(message, cause);
	}

	public InvalidIdentifierException(Throwable cause) {
		super(cause);
	}
}
