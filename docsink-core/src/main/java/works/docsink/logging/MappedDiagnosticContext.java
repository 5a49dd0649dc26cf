package works.docsink.logging;

import org.slf4j.MDC;

public final class MappedDiagnosticContext {
	public static MDCScope setupMDC(String key, String value) {
		MDCScope result = new MDCScope(key);
		MDC.put(key, value);
		return result;
	}

	/**
	 * This is like {@link org.slf4j.MDC.MDCCloseable} except instead of
	 * deleting the MDC entry at the end, it restores it to its prior value,
	 * which allows us to nest these.
	 *
	 * <p>
	 * Note that for a try block using one of these, the catch and finally
	 * blocks will run after {@link #close()} and won't have the context.
	 * You probably want to use this in a try block with no catch or finally clause.
	 */
	public static final class MDCScope implements AutoCloseable {
		private final String key;
		private final String oldValue;

		private MDCScope(String key) {
			this.key = key;
			this.oldValue = MDC.get(key);
		}

		@Override
		public void close() {
			if (oldValue == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, oldValue);
			}
		}
	}

	private MappedDiagnosticContext() { }
}
