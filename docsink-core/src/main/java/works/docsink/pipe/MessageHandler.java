package works.docsink.pipe;

import works.docsink.events.ChangeEvent;

@FunctionalInterface
public interface MessageHandler {
	/**
	 * Handle one event. Problems with the event itself should go to the pipe's
	 * {@link works.docsink.errors.ErrorChannel ErrorChannel}, not be thrown.
	 *
	 * @return the event as handled, for whatever comes next in the pipeline
	 */
	ChangeEvent handle(ChangeEvent event);
}
