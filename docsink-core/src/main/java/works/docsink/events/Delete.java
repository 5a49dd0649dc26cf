package works.docsink.events;

/**
 * Requests that the document identified by the {@link ChangeEvent#ID_FIELD id} field
 * of <code>payload</code> be removed.
 */
public record Delete(
	Object payload
) implements ChangeEvent {
	@Override
	public Operation op() {
		return Operation.DELETE;
	}

	@Override
	public <R> R accept(ChangeEventVisitor<R> visitor) {
		return visitor.visitDelete(this);
	}
}
