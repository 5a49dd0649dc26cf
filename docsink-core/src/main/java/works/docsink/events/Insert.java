package works.docsink.events;

/**
 * Requests that <code>payload</code> be added to the collection.
 * If a document with the same identifier already exists, the existing one wins.
 */
public record Insert(
	Object payload
) implements ChangeEvent {
	@Override
	public Operation op() {
		return Operation.INSERT;
	}

	@Override
	public <R> R accept(ChangeEventVisitor<R> visitor) {
		return visitor.visitInsert(this);
	}
}
