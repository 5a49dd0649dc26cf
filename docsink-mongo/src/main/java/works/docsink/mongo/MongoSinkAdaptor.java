package works.docsink.mongo;

import com.mongodb.MongoClientSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.docsink.SinkAdaptor;
import works.docsink.WriteOutcome;
import works.docsink.errors.SinkError;
import works.docsink.events.ChangeEvent;
import works.docsink.logging.MappedDiagnosticContext.MDCScope;
import works.docsink.pipe.Pipe;

import static works.docsink.errors.ErrorLevel.CRITICAL;
import static works.docsink.errors.ErrorLevel.ERROR;
import static works.docsink.logging.MappedDiagnosticContext.setupMDC;
import static works.docsink.logging.MdcKeys.ADAPTOR_PATH;

/**
 * Writes every event arriving on a {@link Pipe} to one MongoDB collection.
 * <p>
 * {@link #listen()} empties the collection before the first event, then applies events
 * one at a time in delivery order. A bad event or a failed write is reported on the
 * pipe's error channel and the stream carries on; only failing to connect stops the adaptor.
 */
public class MongoSinkAdaptor implements SinkAdaptor {
	private final Pipe pipe;
	private final MongoSinkSettings settings;
	private final MongoClientSettings clientSettings;
	private final OperationApplier applier;

	public MongoSinkAdaptor(Pipe pipe, MongoSinkSettings settings, MongoClientSettings clientSettings, OperationApplier applier) {
		this.pipe = pipe;
		this.settings = settings;
		this.clientSettings = clientSettings;
		this.applier = applier;
	}

	public MongoSinkAdaptor(Pipe pipe, MongoSinkSettings settings, MongoClientSettings clientSettings) {
		this(pipe, settings, clientSettings, new OperationApplier(settings.debug()));
	}

	public MongoSinkAdaptor(Pipe pipe, MongoSinkSettings settings) {
		this(pipe, settings, MongoClientSettings.builder().build());
	}

	/**
	 * @throws UnsupportedOperationException always
	 */
	@Override
	public void start() {
		throw new UnsupportedOperationException("mongo sink can't function as a source");
	}

	/**
	 * @throws SessionOpenException if the session can't be opened; this is also reported
	 * as a {@link works.docsink.errors.ErrorLevel#CRITICAL CRITICAL} error.
	 */
	@Override
	public void listen() throws InterruptedException {
		MongoSession session;
		try (MDCScope __ = setupMDC(ADAPTOR_PATH, pipe.path())) {
			session = openSession();
			LOGGER.debug("Session open on {}; listening", settings.namespace());
		}
		try (session) {
			pipe.listen(event -> applyOp(session, event));
		}
	}

	@Override
	public void stop() {
		pipe.stop();
	}

	private MongoSession openSession() {
		try {
			return MongoSession.open(settings, clientSettings);
		} catch (SessionOpenException e) {
			LOGGER.debug("Unable to open session for {}", pipe.path(), e);
			pipe.errorChannel().report(new SinkError(CRITICAL, pipe.path(), errorMessage(e.getMessage()), null));
			throw e;
		}
	}

	ChangeEvent applyOp(MongoSession session, ChangeEvent event) {
		WriteOutcome outcome = applier.apply(session, event);
		if (!outcome.isSuccess()) {
			pipe.errorChannel().report(new SinkError(ERROR, pipe.path(), errorMessage(outcome.message()), event.payload()));
		}
		return event;
	}

	private static String errorMessage(String cause) {
		return "mongo error (" + cause + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MongoSinkAdaptor.class);
}
