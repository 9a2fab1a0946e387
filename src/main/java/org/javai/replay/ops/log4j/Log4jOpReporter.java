package org.javai.replay.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.replay.PolicyException;
import org.javai.replay.ops.OpReporter;
import org.javai.replay.retry.Attempt;

import java.net.http.HttpRequest;
import java.time.Duration;

import static org.javai.replay.ops.OpReporterUtils.describeOutcome;
import static org.javai.replay.ops.OpReporterUtils.describeRequest;

/**
 * Reports retry events using Log4j2 structured logging.
 *
 * <p>Each event carries a marker so that appenders and filters can route it:
 * <ul>
 *   <li>{@code RETRY} → INFO</li>
 *   <li>{@code RETRY_EXHAUSTED} → WARN</li>
 *   <li>{@code CANCELED} → INFO</li>
 *   <li>{@code POLICY_ERROR} → ERROR</li>
 * </ul>
 */
public class Log4jOpReporter implements OpReporter {

	public static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	public static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	public static final Marker CANCELED_MARKER = MarkerManager.getMarker("CANCELED");
	public static final Marker POLICY_ERROR_MARKER = MarkerManager.getMarker("POLICY_ERROR");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.replay.OpReporter"));
	}

	/**
	 * Creates a Log4jOpReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jOpReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(HttpRequest request, Attempt attempt, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry after attempt {} for [{}] in {} ms. Outcome: {}",
				attempt.number(),
				describeRequest(request),
				delay.toMillis(),
				describeOutcome(attempt));
	}

	@Override
	public void reportRetryExhausted(HttpRequest request, Attempt attempt, String reason) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Retry exhausted for [{}] after {} attempts ({}). Outcome: {}",
				describeRequest(request),
				attempt.number(),
				reason != null ? reason : "no reason given",
				describeOutcome(attempt));
	}

	@Override
	public void reportCanceled(HttpRequest request, int attempts) {
		logger.atInfo()
			.withMarker(CANCELED_MARKER)
			.log("Request [{}] canceled after {} attempts",
				describeRequest(request),
				attempts);
	}

	@Override
	public void reportPolicyError(HttpRequest request, Attempt attempt, PolicyException error) {
		logger.atError()
			.withMarker(POLICY_ERROR_MARKER)
			.withThrowable(error)
			.log("Retry policy aborted [{}] on attempt {}: {}",
				describeRequest(request),
				attempt.number(),
				error.getMessage());
	}
}
