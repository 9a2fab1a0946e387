package org.javai.replay.ops.metrics;

import org.javai.replay.PolicyException;
import org.javai.replay.ops.OpReporter;
import org.javai.replay.retry.Attempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

import static org.javai.replay.ops.OpReporterUtils.escapeJson;
import static org.javai.replay.ops.OpReporterUtils.host;

/**
 * Reports retry events as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one JSON object per event, suitable for metrics aggregation and analysis
 * pipelines. The tracking key is the request host, prefixed with a configurable namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.api.example.com","method":"POST",...}
 * }</pre>
 *
 * <p>Constructor options follow the Log4jOpReporter pattern:</p>
 * <ul>
 *   <li>{@link #MetricsOpReporter()} - no namespace, default logger</li>
 *   <li>{@link #MetricsOpReporter(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsOpReporter(String, String)} - with namespace and custom logger name</li>
 * </ul>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.replay.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsOpReporter with no namespace and the default logger.
	 */
	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsOpReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsOpReporter with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsOpReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsOpReporter with explicit configuration.
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportRetryAttempt(HttpRequest request, Attempt attempt, Duration delay) {
		StringBuilder sb = start("retry_attempt", attempt.completedAt(), request);
		appendField(sb, "attemptNumber", String.valueOf(attempt.number()));
		appendField(sb, "delayMs", String.valueOf(delay.toMillis()));
		appendOutcome(sb, attempt);
		emit(sb);
	}

	@Override
	public void reportRetryExhausted(HttpRequest request, Attempt attempt, String reason) {
		StringBuilder sb = start("retry_exhausted", attempt.completedAt(), request);
		appendField(sb, "totalAttempts", String.valueOf(attempt.number()));
		if (reason != null) {
			appendField(sb, "reason", reason);
		}
		appendOutcome(sb, attempt);
		emit(sb);
	}

	@Override
	public void reportCanceled(HttpRequest request, int attempts) {
		StringBuilder sb = start("canceled", clock.instant(), request);
		appendField(sb, "totalAttempts", String.valueOf(attempts));
		emit(sb);
	}

	@Override
	public void reportPolicyError(HttpRequest request, Attempt attempt, PolicyException error) {
		StringBuilder sb = start("policy_error", attempt.completedAt(), request);
		appendField(sb, "attemptNumber", String.valueOf(attempt.number()));
		appendField(sb, "message", error.getMessage());
		appendOutcome(sb, attempt);
		emit(sb);
	}

	String buildTrackingKey(HttpRequest request) {
		if (namespace == null) {
			return host(request);
		}
		return namespace + "." + host(request);
	}

	private StringBuilder start(String eventType, Instant timestamp, HttpRequest request) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		sb.append("\"eventType\":\"").append(eventType).append("\"");
		appendField(sb, "timestamp", ISO_FORMATTER.format(timestamp));
		appendField(sb, "trackingKey", buildTrackingKey(request));
		appendField(sb, "method", request.method());
		appendField(sb, "uri", request.uri().toString());
		return sb;
	}

	private void appendOutcome(StringBuilder sb, Attempt attempt) {
		if (attempt.statusCode().isPresent()) {
			appendField(sb, "status", String.valueOf(attempt.statusCode().getAsInt()));
		}
		if (attempt.error() != null) {
			appendField(sb, "error", attempt.error().getClass().getName());
		}
	}

	private void appendField(StringBuilder sb, String key, String value) {
		sb.append(",\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private void emit(StringBuilder sb) {
		sb.append("}");
		logger.info(sb.toString());
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
