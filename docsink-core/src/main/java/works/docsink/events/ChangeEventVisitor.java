package works.docsink.events;

/**
 * Switch patterns are still a preview feature in Java 17, so code that
 * handles every kind of {@link ChangeEvent} dispatches through this instead.
 * Adding a case to {@link ChangeEvent} breaks every visitor, which is the point.
 */
public interface ChangeEventVisitor<R> {
	R visitInsert(Insert event);
	R visitUpdate(Update event);
	R visitDelete(Delete event);

	default R visit(ChangeEvent event) {
		return event.accept(this);
	}
}
