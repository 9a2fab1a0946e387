package org.javai.replay.ops;

import org.javai.replay.retry.Attempt;

import java.net.URI;
import java.net.http.HttpRequest;

/**
 * Shared utilities for OpReporter implementations.
 */
public final class OpReporterUtils {

	private OpReporterUtils() {
		// Utility class
	}

	/**
	 * Escapes special characters for JSON string values.
	 */
	public static String escapeJson(String s) {
		if (s == null) return "";
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}

	/**
	 * Formats a request as {@code METHOD uri} for messages.
	 */
	public static String describeRequest(HttpRequest request) {
		return request.method() + " " + request.uri();
	}

	/**
	 * Formats an attempt's outcome: the status code, or the error type and message.
	 */
	public static String describeOutcome(Attempt attempt) {
		if (attempt.error() != null) {
			String message = attempt.error().getMessage();
			return attempt.error().getClass().getName() + (message != null ? ": " + message : "");
		}
		if (attempt.statusCode().isPresent()) {
			return "status " + attempt.statusCode().getAsInt();
		}
		return "no response";
	}

	/**
	 * The host of the request URI, or "unknown" for URIs without one.
	 */
	public static String host(HttpRequest request) {
		URI uri = request.uri();
		return uri.getHost() != null ? uri.getHost() : "unknown";
	}
}
