package org.javai.result.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.result.ops.AdapterListener;

/**
 * Reports adapter decisions using Log4j2 logging.
 *
 * <p>Captured exceptions are expected outcomes and are logged at a configurable level
 * (DEBUG by default) without a stack trace. Propagated exceptions were not anticipated
 * by the adapter's selectors and are logged at WARN with the stack trace.
 */
public class Log4jAdapterListener implements AdapterListener {

	private static final Marker CAPTURED_MARKER = MarkerManager.getMarker("RESULT_CAPTURED");
	private static final Marker PROPAGATED_MARKER = MarkerManager.getMarker("RESULT_PROPAGATED");

	private final Logger logger;
	private final Level capturedLevel;

	/**
	 * Creates a Log4jAdapterListener using the default logger name.
	 */
	public Log4jAdapterListener() {
		this(LogManager.getLogger("org.javai.result.Adapter"), Level.DEBUG);
	}

	/**
	 * Creates a Log4jAdapterListener with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jAdapterListener(String loggerName) {
		this(LogManager.getLogger(loggerName), Level.DEBUG);
	}

	/**
	 * Creates a Log4jAdapterListener with a specific logger and level for captured exceptions.
	 *
	 * @param logger the Log4j logger to use
	 * @param capturedLevel the level used for captured exceptions
	 */
	public Log4jAdapterListener(Logger logger, Level capturedLevel) {
		this.logger = logger;
		this.capturedLevel = capturedLevel;
	}

	@Override
	public void captured(String operation, Throwable exception) {
		logger.atLevel(capturedLevel)
			.withMarker(CAPTURED_MARKER)
			.log("Operation [{}] failed with {}: {}",
				operation,
				exception.getClass().getName(),
				exception.getMessage());
	}

	@Override
	public void propagated(String operation, Throwable exception) {
		logger.atWarn()
			.withMarker(PROPAGATED_MARKER)
			.withThrowable(exception)
			.log("Operation [{}] threw unselected {}",
				operation,
				exception.getClass().getName());
	}
}
