package works.docsink.mongo;

import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.DeleteOneModel;
import com.mongodb.client.model.InsertOneModel;
import com.mongodb.client.model.ReplaceOneModel;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.WriteModel;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.docsink.WriteOutcome;
import works.docsink.events.ChangeEvent;
import works.docsink.events.ChangeEventVisitor;
import works.docsink.events.Delete;
import works.docsink.events.Insert;
import works.docsink.events.Update;
import works.docsink.exceptions.InvalidIdentifierException;

import static com.mongodb.client.model.Filters.eq;
import static works.docsink.WriteOutcome.FailureKind.INVALID_IDENTIFIER;
import static works.docsink.WriteOutcome.FailureKind.MALFORMED_PAYLOAD;
import static works.docsink.WriteOutcome.FailureKind.STORE_WRITE_ERROR;
import static works.docsink.events.ChangeEvent.ID_FIELD;

/**
 * Turns one {@link ChangeEvent} into one MongoDB write and reports how it went.
 * <ul>
 *     <li>{@link Insert} is a plain insert. If the document is already there, it stays as it was.</li>
 *     <li>{@link Update} is an upsert that replaces the whole document.</li>
 *     <li>{@link Delete} removes the document named by the payload's <code>id</code>.</li>
 * </ul>
 * The payload's <code>id</code> is written as <code>_id</code> too, so the store enforces its uniqueness.
 * <p>
 * Never throws for problems with an event or with the store;
 * those come back as a {@link WriteOutcome.Status#FAILED FAILED} outcome.
 * A document holding a value the driver has no codec for is a malformed payload.
 */
@RequiredArgsConstructor
public class OperationApplier {
	static final String MALFORMED_MESSAGE = "document must be a json document";
	static final String INVALID_ID_MESSAGE = "cannot delete an object with a nil id";
	static final String STORE_ERROR_PREFIX = "problem inserting docs";

	private final WriteErrorClassifier classifier;
	private final boolean debug;

	public OperationApplier(boolean debug) {
		this(new DuplicateKeyClassifier(), debug);
	}

	public WriteOutcome apply(MongoSession session, ChangeEvent event) {
		return event.accept(new Dispatcher(session.collection()));
	}

	@RequiredArgsConstructor
	private final class Dispatcher implements ChangeEventVisitor<WriteOutcome> {
		final MongoCollection<Document> collection;

		@Override
		public WriteOutcome visitInsert(Insert event) {
			if (!event.isDocument()) {
				return malformed(event);
			}
			return execute(collection, new InsertOneModel<>(storedDocument(event.document())));
		}

		@Override
		public WriteOutcome visitUpdate(Update event) {
			if (!event.isDocument()) {
				return malformed(event);
			}
			Document doc = storedDocument(event.document());
			Object key = doc.get("_id");
			if (key == null) {
				LOGGER.debug("Update has no {}; inserting", ID_FIELD);
				return execute(collection, new InsertOneModel<>(doc));
			}
			return execute(collection, new ReplaceOneModel<>(eq("_id", key), doc, new ReplaceOptions().upsert(true)));
		}

		@Override
		public WriteOutcome visitDelete(Delete event) {
			String id;
			try {
				id = event.idString(ID_FIELD);
			} catch (InvalidIdentifierException e) {
				LOGGER.debug("Rejecting delete", e);
				return WriteOutcome.failed(INVALID_IDENTIFIER, INVALID_ID_MESSAGE);
			}
			return execute(collection, new DeleteOneModel<>(eq("_id", id)));
		}

		private WriteOutcome malformed(ChangeEvent event) {
			LOGGER.debug("Rejecting {} with non-document payload", event.op());
			return WriteOutcome.failed(MALFORMED_PAYLOAD, MALFORMED_MESSAGE);
		}
	}

	private WriteOutcome execute(MongoCollection<Document> collection, WriteModel<Document> model) {
		WriteAcknowledgement ack;
		try {
			collection.bulkWrite(List.of(model));
			ack = WriteAcknowledgement.NO_ERRORS;
		} catch (MongoBulkWriteException e) {
			ack = WriteAcknowledgement.from(e);
		} catch (CodecConfigurationException e) {
			LOGGER.debug("Payload can't be encoded", e);
			return WriteOutcome.failed(MALFORMED_PAYLOAD, MALFORMED_MESSAGE + " (" + e.getMessage() + ")");
		} catch (MongoException e) {
			LOGGER.debug("Write did not reach the store", e);
			return WriteOutcome.failed(STORE_WRITE_ERROR, e.getMessage());
		}
		return interpret(ack);
	}

	WriteOutcome interpret(WriteAcknowledgement ack) {
		if (!ack.hasErrors()) {
			return WriteOutcome.applied();
		}
		if (classifier.isIgnorable(ack.firstErrorCode(), ack.firstErrorMessage())) {
			LOGGER.debug("Ignoring write error {}: {}", ack.firstErrorCode(), ack.firstErrorMessage());
			return WriteOutcome.conflictIgnored(ack.firstErrorMessage());
		}
		if (debug) {
			LOGGER.info("Reported {} errors", ack.errorCount());
		}
		return WriteOutcome.failed(STORE_WRITE_ERROR, STORE_ERROR_PREFIX + "\n" + ack.firstErrorMessage());
	}

	/**
	 * @return a copy of <code>payload</code> whose <code>_id</code> is derived from its <code>id</code>, if any.
	 * Identifiers are converted the same way {@link ChangeEvent#idString} converts them,
	 * so that a delete finds what an insert wrote.
	 */
	static Document storedDocument(Map<String, Object> payload) {
		Document result = new Document(payload);
		Object id = payload.get(ID_FIELD);
		if (id != null) {
			String idString = ChangeEvent.identifierString(id);
			result.put("_id", idString == null ? id : idString);
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OperationApplier.class);
}
