package works.docsink.errors;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Holds reported errors until the consumer takes them.
 */
public class QueueErrorChannel implements ErrorChannel {
	private final BlockingQueue<SinkError> queue = new LinkedBlockingQueue<>();

	@Override
	public void report(SinkError error) {
		queue.add(error);
	}

	public SinkError take() throws InterruptedException {
		return queue.take();
	}

	/**
	 * @return the next error, or null if none arrives in time
	 */
	public SinkError poll(long timeout, TimeUnit unit) throws InterruptedException {
		return queue.poll(timeout, unit);
	}

	/**
	 * @return all errors reported so far, removing them from the channel
	 */
	public List<SinkError> drain() {
		List<SinkError> result = new ArrayList<>();
		queue.drainTo(result);
		return result;
	}
}
