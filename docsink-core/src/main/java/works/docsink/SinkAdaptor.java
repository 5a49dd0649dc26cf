package works.docsink;

/**
 * Lifecycle of an adaptor attached to a {@link works.docsink.pipe.Pipe Pipe}.
 * <p>
 * An adaptor owns whatever store connection it opens, from {@link #listen()}
 * until {@link #listen()} returns.
 */
public interface SinkAdaptor {
	/**
	 * Run as a source, producing events into the pipe.
	 *
	 * @throws UnsupportedOperationException if this adaptor can only act as a sink
	 */
	void start();

	/**
	 * Run as a sink: connect, then consume events from the pipe on the calling thread
	 * until {@link #stop()} is called.
	 */
	void listen() throws InterruptedException;

	/**
	 * Ask a running {@link #listen()} to return once the event in flight is done.
	 * Does not wait.
	 */
	void stop();
}
