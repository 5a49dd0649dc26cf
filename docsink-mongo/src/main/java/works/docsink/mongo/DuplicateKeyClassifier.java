package works.docsink.mongo;

import com.mongodb.ErrorCategory;

/**
 * Ignores duplicate-key errors, which arise when an already-applied insert is delivered again.
 * <p>
 * Classification uses the error code when there is one.
 * Only when the code is missing does it look for {@link #DUPLICATE_KEY_MESSAGE} in the message text.
 */
public class DuplicateKeyClassifier implements WriteErrorClassifier {
	/**
	 * Prefix of the server's message for error code 11000.
	 */
	public static final String DUPLICATE_KEY_MESSAGE = "E11000 duplicate key";

	@Override
	public boolean isIgnorable(Integer code, String message) {
		if (code != null) {
			return ErrorCategory.fromErrorCode(code) == ErrorCategory.DUPLICATE_KEY;
		}
		return message != null && message.contains(DUPLICATE_KEY_MESSAGE);
	}
}
