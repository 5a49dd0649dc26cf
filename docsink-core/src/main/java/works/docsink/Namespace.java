package works.docsink;

/**
 * A <code>database.collection</code> pair identifying the sink's target.
 */
public record Namespace(
	String database,
	String collection
) {
	public Namespace {
		if (database == null || database.isEmpty() || collection == null || collection.isEmpty()) {
			throw new IllegalArgumentException(MALFORMED);
		}
	}

	/**
	 * Splits on the first dot, so the collection name may itself contain dots.
	 */
	public static Namespace parse(String namespace) {
		if (namespace == null) {
			throw new IllegalArgumentException(MALFORMED);
		}
		int dot = namespace.indexOf('.');
		if (dot < 0) {
			throw new IllegalArgumentException(MALFORMED);
		}
		return new Namespace(namespace.substring(0, dot), namespace.substring(dot + 1));
	}

	@Override
	public String toString() {
		return database + "." + collection;
	}

	private static final String MALFORMED = "malformed namespace, expected a '.' deliminated string";
}
