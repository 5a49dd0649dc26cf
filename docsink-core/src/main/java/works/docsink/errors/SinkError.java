package works.docsink.errors;

import static java.util.Objects.requireNonNull;

/**
 * A problem encountered by an adaptor, described as data so it can be
 * reported without interrupting the stream.
 *
 * @param path identifies the adaptor instance that reported it
 * @param record the offending payload, so an operator can replay or discard it; may be null
 */
public record SinkError(
	ErrorLevel level,
	String path,
	String message,
	Object record
) {
	public SinkError {
		requireNonNull(level);
		requireNonNull(path);
		requireNonNull(message);
	}

	@Override
	public String toString() {
		return level + ": " + path + ": " + message;
	}
}
