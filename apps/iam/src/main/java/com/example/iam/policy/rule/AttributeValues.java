package com.example.iam.policy.rule;

import java.math.BigDecimal;
import java.net.InetAddress;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Optional;

/**
 * Coercions between attribute values and the comparison values written in policies.
 * Policy values usually arrive from YAML as strings or boxed numbers.
 */
final class AttributeValues {

    private AttributeValues() {}

    static Optional<BigDecimal> asNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return Optional.of(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            return Optional.of(new BigDecimal(number.toString()));
        }
        if (value instanceof String text) {
            try {
                return Optional.of(new BigDecimal(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static Optional<Instant> asInstant(Object value) {
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof OffsetDateTime odt) {
            return Optional.of(odt.toInstant());
        }
        if (value instanceof ZonedDateTime zdt) {
            return Optional.of(zdt.toInstant());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Instant.parse(text.trim()));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static Optional<LocalTime> asLocalTime(Object value) {
        if (value instanceof LocalTime time) {
            return Optional.of(time);
        }
        if (value instanceof String text) {
            try {
                return Optional.of(LocalTime.parse(text.trim()));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static Optional<InetAddress> asAddress(Object value) {
        if (value instanceof InetAddress address) {
            return Optional.of(address);
        }
        if (value instanceof String text) {
            return CidrBlock.parseAddress(text);
        }
        return Optional.empty();
    }

    static boolean isTemporal(Object value) {
        return value instanceof Instant || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime || value instanceof Date;
    }

    /**
     * Equality after coercing {@code expected} to the runtime type of {@code actual}.
     */
    static boolean looselyEqual(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        if (actual instanceof Number) {
            Optional<BigDecimal> a = asNumber(actual);
            Optional<BigDecimal> e = asNumber(expected);
            return a.isPresent() && e.isPresent() && a.get().compareTo(e.get()) == 0;
        }
        if (isTemporal(actual)) {
            Optional<Instant> a = asInstant(actual);
            Optional<Instant> e = asInstant(expected);
            return a.isPresent() && e.isPresent() && a.get().equals(e.get());
        }
        if (actual instanceof InetAddress address) {
            return asAddress(expected).map(address::equals).orElse(false);
        }
        if (actual instanceof Boolean flag) {
            return expected instanceof Boolean ? flag.equals(expected)
                    : String.valueOf(flag).equalsIgnoreCase(String.valueOf(expected).trim());
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }
}
