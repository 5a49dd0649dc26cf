package works.docsink;

import static java.util.Objects.requireNonNull;

/**
 * The normalized result of applying one change event to a store.
 *
 * @param failureKind null unless {@link #status} is {@link Status#FAILED FAILED}
 * @param message human-readable cause; null for {@link Status#APPLIED APPLIED}
 */
public record WriteOutcome(
	Status status,
	FailureKind failureKind,
	String message
) {
	public WriteOutcome {
		requireNonNull(status);
		if ((status == Status.FAILED) != (failureKind != null)) {
			throw new IllegalArgumentException("failureKind must be given exactly when status is FAILED");
		}
	}

	public enum Status {
		APPLIED,

		/**
		 * The store rejected the write because the document already exists.
		 * Expected under at-least-once delivery, so this counts as success.
		 */
		CONFLICT_IGNORED,

		FAILED,
	}

	public enum FailureKind {
		/**
		 * An insert or update whose payload is not a document. The store was not contacted.
		 */
		MALFORMED_PAYLOAD,

		/**
		 * A delete with no usable identifier. The store was not contacted.
		 */
		INVALID_IDENTIFIER,

		/**
		 * The store reported an error, or could not be reached.
		 */
		STORE_WRITE_ERROR,
	}

	public static WriteOutcome applied() {
		return APPLIED;
	}

	public static WriteOutcome conflictIgnored(String storeMessage) {
		return new WriteOutcome(Status.CONFLICT_IGNORED, null, storeMessage);
	}

	public static WriteOutcome failed(FailureKind kind, String message) {
		return new WriteOutcome(Status.FAILED, requireNonNull(kind), message);
	}

	public boolean isSuccess() {
		return status != Status.FAILED;
	}

	private static final WriteOutcome APPLIED = new WriteOutcome(Status.APPLIED, null, null);
}
