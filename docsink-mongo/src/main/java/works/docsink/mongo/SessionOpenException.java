package works.docsink.mongo;

/**
 * Thrown from {@link MongoSession#open} if the store can't be reached, or if the
 * target collection can't be reset and {@link MongoSinkSettings.ResetFailureMode#FAIL FAIL}
 * is in effect. The adaptor cannot start without a session.
 */
public class SessionOpenException extends RuntimeException {
	public SessionOpenException(String message) {
		super(message);
	}

	public SessionOpenException(String message, Throwable cause) {
		super(message, cause);
	}

	public SessionOpenException(Throwable cause) {
		super(cause);
	}
}
