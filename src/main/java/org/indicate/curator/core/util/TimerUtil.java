package org.indicate.curator.core.util;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs how long each step of a long-running job takes, at a chosen logging level.
 */
public class TimerUtil {

	private static final Logger logger = LoggerFactory.getLogger(TimerUtil.class);

	private final String timerName;
	private final Level loggingLevel;
	private final long start;
	private long lastCheck;

	public TimerUtil(String timerName) {
		this(timerName, Level.INFO);
	}

	public TimerUtil(String timerName, Level loggingLevel) {
		this.timerName = timerName;
		this.loggingLevel = loggingLevel;
		this.start = System.currentTimeMillis();
		this.lastCheck = start;
	}

	/**
	 * Logs the time since the previous checkpoint, or since the timer started.
	 */
	public synchronized void checkpoint(String name) {
		long now = System.currentTimeMillis();
		float secondsTaken = getDurationSeconds(lastCheck, now);
		lastCheck = now;
		log("Timer {}: {} took {} seconds", timerName, name, secondsTaken);
	}

	public float finish() {
		float secondsTaken = getDurationSeconds(start, System.currentTimeMillis());
		log("Timer {}: total took {} seconds", timerName, secondsTaken);
		return secondsTaken;
	}

	public static float getDurationSeconds(long startMilliseconds, long endMilliseconds) {
		float millisTaken = endMilliseconds - startMilliseconds;
		return millisTaken / 1000f;
	}

	private void log(String message, Object... arguments) {
		switch (loggingLevel.toString()) {
			case "TRACE" -> logger.trace(message, arguments);
			case "DEBUG" -> logger.debug(message, arguments);
			case "WARN" -> logger.warn(message, arguments);
			case "ERROR" -> logger.error(message, arguments);
			case "OFF" -> {
			}
			default -> logger.info(message, arguments);
		}
	}

}
