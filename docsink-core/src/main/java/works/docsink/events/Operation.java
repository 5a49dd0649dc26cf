package works.docsink.events;

public enum Operation {
	INSERT,
	UPDATE,
	DELETE,
}
