package works.docsink.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.docsink.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.stream.Collectors.toMap;
import static works.docsink.logging.MdcKeys.ADAPTOR_PATH;

/**
 * Lets callers raise the log threshold of particular loggers for one adaptor
 * without touching any other adaptor in the same process.
 * <p>
 * Add this filter to an appender; then {@link #register} a {@link LogController}
 * for the adaptor's path. Events carrying that path in the MDC key
 * {@link MdcKeys#ADAPTOR_PATH} are subject to the controller's overrides.
 */
public class SinkLogFilter extends Filter<ILoggingEvent> {
	private static final ConcurrentHashMap<String, LogController> controllersByPath = new ConcurrentHashMap<>();

	public static final class LogController {
		final Map<String, Level> overrides = new ConcurrentHashMap<>();

		// We'd like to use SLF4J's "Level" but that doesn't support OFF
		public void setLogging(Level level, Class<?>... loggers) {
			// Put them all in one atomic operation
			overrides.putAll(Stream.of(loggers).collect(toMap(Class::getName, c->level)));
		}
	}

	public static LogController withOverrides(String path, Level level, Class<?>... loggers) {
		LogController controller = new LogController();
		controller.setLogging(level, loggers);
		register(path, controller);
		return controller;
	}

	public static void register(String path, LogController controller) {
		LOGGER.debug("Registering controller {} for adaptor \"{}\"", System.identityHashCode(controller), path);
		LogController old = controllersByPath.put(path, controller);
		assert old == null: "Must not create two log controllers for the same adaptor path: \"" + path + "\"";
	}

	public static void unregister(String path) {
		controllersByPath.remove(path);
	}

	@Override
	public FilterReply decide(ILoggingEvent event) {
		String path = event.getMDCPropertyMap().get(ADAPTOR_PATH);
		if (path == null) {
			return NEUTRAL;
		}
		var controller = controllersByPath.get(path);
		if (controller == null) {
			return NEUTRAL;
		}
		Level level = controller.overrides.get(event.getLoggerName());
		if (level == null) {
			return NEUTRAL;
		}
		if (event.getLevel().isGreaterOrEqual(level)) {
			return NEUTRAL;
		} else {
			return DENY;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SinkLogFilter.class);
}
