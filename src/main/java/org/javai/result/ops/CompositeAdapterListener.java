package org.javai.result.ops;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * An {@link AdapterListener} that delegates to multiple listeners.
 *
 * <p>All configured listeners receive every call. If a listener throws an exception,
 * it is logged at WARN and the remaining listeners still execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * AdapterListener listener = CompositeAdapterListener.of(
 *     new Log4jAdapterListener(),
 *     metricsListener
 * );
 * }</pre>
 */
public final class CompositeAdapterListener implements AdapterListener {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeAdapterListener.class);

	private final List<AdapterListener> listeners;

	private CompositeAdapterListener(List<AdapterListener> listeners) {
		this.listeners = List.copyOf(listeners);
	}

	/**
	 * Creates a composite listener from the given listeners.
	 *
	 * @param listeners the listeners to delegate to
	 * @return a composite that fans out to all given listeners
	 */
	public static CompositeAdapterListener of(AdapterListener... listeners) {
		return of(Arrays.asList(listeners));
	}

	/**
	 * Creates a composite listener from a collection of listeners.
	 * Null entries are skipped.
	 *
	 * @param listeners the listeners to delegate to
	 * @return a composite that fans out to all given listeners
	 */
	public static CompositeAdapterListener of(Collection<? extends AdapterListener> listeners) {
		List<AdapterListener> present = new ArrayList<>();
		for (AdapterListener listener : listeners) {
			if (listener != null) {
				present.add(listener);
			}
		}
		return new CompositeAdapterListener(present);
	}

	@Override
	public void captured(String operation, Throwable exception) {
		for (AdapterListener listener : listeners) {
			try {
				listener.captured(operation, exception);
			} catch (Exception e) {
				logListenerError("captured", listener, e);
			}
		}
	}

	@Override
	public void propagated(String operation, Throwable exception) {
		for (AdapterListener listener : listeners) {
			try {
				listener.propagated(operation, exception);
			} catch (Exception e) {
				logListenerError("propagated", listener, e);
			}
		}
	}

	/**
	 * Returns the number of listeners in this composite.
	 */
	public int size() {
		return listeners.size();
	}

	private static void logListenerError(String method, AdapterListener listener, Exception e) {
		LOG.warn("AdapterListener.{} failed for {}", method, listener.getClass().getName(), e);
	}
}
