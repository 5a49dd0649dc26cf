package works.docsink.errors;

/**
 * Where adaptors send the errors they recover from.
 * Implementations must not throw: reporting an error can't itself become an error.
 */
public interface ErrorChannel {
	void report(SinkError error);
}
