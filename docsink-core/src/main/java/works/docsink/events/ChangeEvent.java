package works.docsink.events;

import java.util.Map;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.types.ObjectId;
import works.docsink.exceptions.InvalidIdentifierException;

/**
 * One unit of the incoming operation stream: an {@link Operation} and its payload.
 * <p>
 * The payload is whatever the upstream source delivered. For {@link Insert} and {@link Update}
 * it is expected to be a document (see {@link #isDocument()}); for {@link Delete} only
 * the identifier field matters. Nothing about the payload is checked at construction time,
 * because a malformed event must still reach the sink so it can be reported.
 */
public sealed interface ChangeEvent permits Insert, Update, Delete {
	String ID_FIELD = "id";

	Object payload();

	Operation op();

	<R> R accept(ChangeEventVisitor<R> visitor);

	/**
	 * @return true if {@link #payload()} is a key/value mapping whose keys are all strings.
	 */
	default boolean isDocument() {
		if (payload() instanceof Map<?, ?> map) {
			return map.keySet().stream().allMatch(k -> k instanceof String);
		}
		return false;
	}

	/**
	 * @throws IllegalStateException if the payload is not a document
	 */
	@SuppressWarnings("unchecked")
	default Map<String, Object> document() {
		if (!isDocument()) {
			throw new IllegalStateException("Payload is not a document: " + describe(payload()));
		}
		return (Map<String, Object>) payload();
	}

	/**
	 * @return the value of <code>key</code> converted to a string
	 * @throws InvalidIdentifierException if the payload has no such key, or its value
	 * is neither a string nor an ObjectId.
	 */
	default String idString(String key) throws InvalidIdentifierException {
		if (!isDocument()) {
			throw new InvalidIdentifierException("Payload is not a document: " + describe(payload()));
		}
		Map<String, Object> doc = document();
		if (!doc.containsKey(key)) {
			throw new InvalidIdentifierException("No key " + key + " found in payload");
		}
		String result = identifierString(doc.get(key));
		if (result == null) {
			throw new InvalidIdentifierException(key + " is not a string or an ObjectId: " + describe(doc.get(key)));
		}
		return result;
	}

	/**
	 * @return the string form of <code>value</code> if it's usable as an identifier; otherwise null.
	 */
	static String identifierString(Object value) {
		if (value instanceof String s) {
			return s;
		} else if (value instanceof ObjectId oid) {
			return oid.toHexString();
		} else if (value instanceof BsonString s) {
			return s.getValue();
		} else if (value instanceof BsonObjectId oid) {
			return oid.getValue().toHexString();
		} else {
			return null;
		}
	}

	private static String describe(Object value) {
		return value == null ? "null" : value.getClass().getSimpleName();
	}

	static ChangeEvent of(Operation op, Object payload) {
		return switch (op) {
			case INSERT -> new Insert(payload);
			case UPDATE -> new Update(payload);
			case DELETE -> new Delete(payload);
		};
	}
}
