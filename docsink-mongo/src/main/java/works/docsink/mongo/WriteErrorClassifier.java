package works.docsink.mongo;

/**
 * Decides which store-reported write errors are expected outcomes
 * rather than failures.
 */
@FunctionalInterface
public interface WriteErrorClassifier {
	/**
	 * @param code the server's error code; null if unavailable
	 * @param message the server's error text; may be null
	 */
	boolean isIgnorable(Integer code, String message);
}
