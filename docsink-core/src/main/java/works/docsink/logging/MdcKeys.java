package works.docsink.logging;

/**
 * Keys to use for SLF4J's Mapped Diagnostic Context.
 */
public final class MdcKeys {
	/**
	 * The path of the adaptor within its pipeline, as given to the pipe.
	 */
	public static final String ADAPTOR_PATH = "docsink.path";

	/**
	 * A sequence number assigned to each change event a pipe hands to its sink.
	 */
	public static final String EVENT = "docsink.event";
}
