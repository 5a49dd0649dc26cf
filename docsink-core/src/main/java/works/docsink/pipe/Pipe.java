package works.docsink.pipe;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.docsink.errors.ErrorChannel;
import works.docsink.errors.LoggingErrorChannel;
import works.docsink.errors.SinkError;
import works.docsink.events.ChangeEvent;
import works.docsink.logging.MappedDiagnosticContext.MDCScope;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static works.docsink.errors.ErrorLevel.ERROR;
import static works.docsink.logging.MappedDiagnosticContext.setupMDC;
import static works.docsink.logging.MdcKeys.ADAPTOR_PATH;
import static works.docsink.logging.MdcKeys.EVENT;

/**
 * Carries change events from a producer to a single listening sink, in order,
 * and carries the sink's errors back out on an {@link ErrorChannel}.
 * <p>
 * Only one thread may be in {@link #listen} at a time; any number may {@link #send}.
 */
public class Pipe {
	private final String path;
	private final ErrorChannel errorChannel;
	private final BlockingQueue<ChangeEvent> queue;
	private final AtomicBoolean stopped = new AtomicBoolean(false);
	private final AtomicLong eventCounter = new AtomicLong(0);

	public Pipe(String path, ErrorChannel errorChannel, int capacity) {
		this.path = path;
		this.errorChannel = errorChannel;
		this.queue = new LinkedBlockingQueue<>(capacity);
	}

	public Pipe(String path, ErrorChannel errorChannel) {
		this(path, errorChannel, DEFAULT_CAPACITY);
	}

	public Pipe(String path) {
		this(path, new LoggingErrorChannel());
	}

	public String path() {
		return path;
	}

	public ErrorChannel errorChannel() {
		return errorChannel;
	}

	/**
	 * Blocks while the pipe is full.
	 */
	public void send(ChangeEvent event) throws InterruptedException {
		queue.put(event);
	}

	public int pending() {
		return queue.size();
	}

	public boolean isStopped() {
		return stopped.get();
	}

	/**
	 * Hands each event to <code>handler</code> in delivery order until {@link #stop()} is called.
	 * Events still queued at that point stay queued.
	 */
	public void listen(MessageHandler handler) throws InterruptedException {
		try (MDCScope __ = setupMDC(ADAPTOR_PATH, path)) {
			LOGGER.debug("Listening");
			while (!stopped.get()) {
				ChangeEvent event = queue.poll(POLL_INTERVAL_MS, MILLISECONDS);
				if (event != null) {
					handleOne(handler, event);
				}
			}
			LOGGER.debug("Stopped listening with {} events pending", queue.size());
		}
	}

	private void handleOne(MessageHandler handler, ChangeEvent event) {
		try (MDCScope __ = setupMDC(EVENT, Long.toString(eventCounter.incrementAndGet()))) {
			LOGGER.debug("Handling {}", event.op());
			try {
				handler.handle(event);
			} catch (RuntimeException e) {
				LOGGER.debug("Handler threw for {}", event.op(), e);
				errorChannel.report(new SinkError(ERROR, path, "unexpected error handling " + event.op() + ": " + e, event.payload()));
			}
		}
	}

	/**
	 * Returns immediately. The event being handled, if any, finishes first.
	 */
	public void stop() {
		LOGGER.debug("Stop requested for {}", path);
		stopped.set(true);
	}

	private static final int DEFAULT_CAPACITY = 1024;
	private static final long POLL_INTERVAL_MS = 100;
	private static final Logger LOGGER = LoggerFactory.getLogger(Pipe.class);
}
