package works.docsink.mongo;

import com.mongodb.MongoBulkWriteException;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.bulk.WriteConcernError;
import java.util.List;

/**
 * What the store said about one write: how many errors, and the first of them.
 *
 * @param firstErrorCode the server's error code, or null if it gave none
 * @param firstErrorMessage null when there are no errors
 */
public record WriteAcknowledgement(
	int errorCount,
	Integer firstErrorCode,
	String firstErrorMessage
) {
	public static final WriteAcknowledgement NO_ERRORS = new WriteAcknowledgement(0, null, null);

	public static WriteAcknowledgement from(MongoBulkWriteException e) {
		List<BulkWriteError> writeErrors = e.getWriteErrors();
		WriteConcernError concernError = e.getWriteConcernError();
		if (!writeErrors.isEmpty()) {
			BulkWriteError first = writeErrors.get(0);
			int count = writeErrors.size() + (concernError == null ? 0 : 1);
			return new WriteAcknowledgement(count, first.getCode(), first.getMessage());
		} else if (concernError != null) {
			return new WriteAcknowledgement(1, concernError.getCode(), concernError.getMessage());
		} else {
			// Shouldn't happen, but the exception itself is still an error
			return new WriteAcknowledgement(1, e.getCode(), e.getMessage());
		}
	}

	public boolean hasErrors() {
		return errorCount != 0;
	}
}
