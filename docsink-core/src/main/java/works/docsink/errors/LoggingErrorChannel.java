package works.docsink.errors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * For pipelines with nobody downstream to collect errors.
 */
public class LoggingErrorChannel implements ErrorChannel {
	@Override
	public void report(SinkError error) {
		switch (error.level()) {
			case NOTICE -> LOGGER.info("{}", error);
			case WARNING -> LOGGER.warn("{}", error);
			case ERROR, CRITICAL -> LOGGER.error("{} record: {}", error, error.record());
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LoggingErrorChannel.class);
}
