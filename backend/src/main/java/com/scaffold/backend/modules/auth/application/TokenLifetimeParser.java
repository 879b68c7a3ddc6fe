package com.scaffold.backend.modules.auth.application;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.scaffold.backend.global.config.InvalidConfigurationException;

/**
 * Parses compact lifetimes such as {@code 30d}, {@code 12h}, {@code 45m} or {@code 30s}.
 */
public final class TokenLifetimeParser {

    private static final Pattern FORMAT = Pattern.compile("^(-?\\d+)([dhms])$");

    private TokenLifetimeParser() {
    }

    public static Duration parse(String expression) {
        if (expression == null) {
            throw new InvalidConfigurationException("Token lifetime must not be null");
        }
        Matcher matcher = FORMAT.matcher(expression.trim());
        if (!matcher.matches()) {
            throw new InvalidConfigurationException("Invalid token lifetime format: " + expression);
        }
        long value;
        try {
            value = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException ex) {
            throw new InvalidConfigurationException("Token lifetime out of range: " + expression, ex);
        }
        try {
            return switch (matcher.group(2)) {
                case "d" -> Duration.ofDays(value);
                case "h" -> Duration.ofHours(value);
                case "m" -> Duration.ofMinutes(value);
                case "s" -> Duration.ofSeconds(value);
                default -> throw new InvalidConfigurationException("Invalid token lifetime unit: " + expression);
            };
        } catch (ArithmeticException ex) {
            throw new InvalidConfigurationException("Token lifetime out of range: " + expression, ex);
        }
    }
}
