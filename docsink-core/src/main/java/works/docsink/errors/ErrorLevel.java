package works.docsink.errors;

public enum ErrorLevel {
	NOTICE,
	WARNING,
	ERROR,

	/**
	 * The adaptor cannot continue.
	 */
	CRITICAL,
}
