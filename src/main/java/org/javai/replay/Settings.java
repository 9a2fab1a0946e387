package org.javai.replay;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * Resolves configuration from system properties with environment variable fallbacks.
 */
public final class Settings {

	private Settings() {
		// Utility class
	}

	/**
	 * Resolves configuration from system property or environment variable, falling back to
	 * a default. Blank values count as missing.
	 */
	public static String resolve(String sysProp, String envVar, String defaultValue) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return defaultValue;
		}
		return value.trim();
	}

	/**
	 * Resolves a duration. Accepts plain milliseconds ({@code 250}) or ISO-8601 ({@code PT1S}).
	 *
	 * @throws IllegalArgumentException if the configured value cannot be parsed
	 */
	public static Duration resolveDuration(String sysProp, String envVar, Duration defaultValue) {
		String value = resolve(sysProp, envVar, null);
		if (value == null) {
			return defaultValue;
		}
		try {
			if (value.chars().allMatch(Character::isDigit)) {
				return Duration.ofMillis(Long.parseLong(value));
			}
			return Duration.parse(value);
		} catch (NumberFormatException | DateTimeParseException e) {
			throw new IllegalArgumentException("Invalid duration for '" + sysProp + "': " + value, e);
		}
	}

	/**
	 * Resolves a decimal number.
	 *
	 * @throws IllegalArgumentException if the configured value cannot be parsed
	 */
	public static double resolveDouble(String sysProp, String envVar, double defaultValue) {
		String value = resolve(sysProp, envVar, null);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid number for '" + sysProp + "': " + value, e);
		}
	}
}
