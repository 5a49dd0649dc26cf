package works.docsink.events;

/**
 * Requests that <code>payload</code> replace whatever document has the same identifier,
 * creating it if there is none.
 */
public record Update(
	Object payload
) implements ChangeEvent {
	@Override
	public Operation op() {
		return Operation.UPDATE;
	}

	@Override
	public <R> R accept(ChangeEventVisitor<R> visitor) {
		return visitor.visitUpdate(this);
	}
}
