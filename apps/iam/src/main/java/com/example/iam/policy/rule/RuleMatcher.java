package com.example.iam.policy.rule;

import com.example.iam.common.util.StringSanitizer;
import com.example.iam.policy.model.Policy;
import com.example.iam.policy.model.Rule;
import com.example.iam.policy.model.RuleGroup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.net.InetAddress;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Evaluates policy rules against an {@link AttributeContext}.
 *
 * <p>Rule evaluation never throws:
 * <ul>
 *   <li>a missing attribute makes the rule false, except for {@code EXISTS} / {@code NOT_EXISTS}</li>
 *   <li>operands of incompatible types make the rule false and log a warning</li>
 * </ul>
 */
@Slf4j
@Component
public class RuleMatcher {

    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    /**
     * A policy matches when every rule holds and every OR-group has a holding rule.
     */
    public boolean matches(Policy policy, AttributeContext context) {
        for (Rule rule : policy.rules()) {
            if (!matches(rule, context)) {
                return false;
            }
        }
        for (RuleGroup group : policy.anyOf()) {
            if (group.anyOf().stream().noneMatch(rule -> matches(rule, context))) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(Rule rule, AttributeContext context) {
        Optional<Object> attribute = context.lookup(rule.attribute());

        switch (rule.operator()) {
            case EXISTS:
                return attribute.isPresent();
            case NOT_EXISTS:
                return attribute.isEmpty();
            default:
                break;
        }
        if (attribute.isEmpty()) {
            return false;
        }

        try {
            return evaluate(rule, attribute.get());
        } catch (TypeMismatch e) {
            log.warn("Rule '{}' evaluated false: {}",
                    StringSanitizer.forLog(rule.toString(), 128), e.getMessage());
            return false;
        }
    }

    private boolean evaluate(Rule rule, Object actual) {
        List<Object> values = rule.values();
        Object expected = rule.firstValue();

        return switch (rule.operator()) {
            case EQUALS -> AttributeValues.looselyEqual(actual, expected);
            case NOT_EQUALS -> !AttributeValues.looselyEqual(actual, expected);
            case CONTAINS -> contains(actual, expected);
            case STARTS_WITH -> text(actual, rule).startsWith(String.valueOf(expected));
            case ENDS_WITH -> text(actual, rule).endsWith(String.valueOf(expected));
            case GREATER_THAN -> compare(actual, expected, rule) > 0;
            case LESS_THAN -> compare(actual, expected, rule) < 0;
            case IN -> in(actual, values);
            case IN_RANGE -> compare(actual, values.get(0), rule) >= 0 && compare(actual, values.get(1), rule) <= 0;
            case TIME_WINDOW -> inTimeWindow(actual, values, rule);
            case IP_RANGE -> inIpRange(actual, values, rule);
            case REGEX -> pattern(String.valueOf(expected)).matcher(text(actual, rule)).matches();
            case EXISTS, NOT_EXISTS -> throw new IllegalStateException("Presence operators are handled earlier");
        };
    }

    private boolean contains(Object actual, Object expected) {
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(element -> AttributeValues.looselyEqual(element, expected));
        }
        if (actual instanceof CharSequence text) {
            return text.toString().contains(String.valueOf(expected));
        }
        throw new TypeMismatch("CONTAINS needs a string or collection attribute, got "
                + actual.getClass().getSimpleName());
    }

    private boolean in(Object actual, List<Object> values) {
        if (actual instanceof Collection<?> collection) {
            return collection.stream()
                    .anyMatch(element -> values.stream().anyMatch(v -> AttributeValues.looselyEqual(element, v)));
        }
        return values.stream().anyMatch(v -> AttributeValues.looselyEqual(actual, v));
    }

    private int compare(Object actual, Object expected, Rule rule) {
        if (actual instanceof Number) {
            BigDecimal a = AttributeValues.asNumber(actual)
                    .orElseThrow(() -> new TypeMismatch("attribute is not a finite number"));
            BigDecimal e = AttributeValues.asNumber(expected)
                    .orElseThrow(() -> new TypeMismatch("value '" + expected + "' is not a number"));
            return a.compareTo(e);
        }
        if (AttributeValues.isTemporal(actual)) {
            Instant a = AttributeValues.asInstant(actual).orElseThrow();
            Instant e = AttributeValues.asInstant(expected)
                    .orElseThrow(() -> new TypeMismatch("value '" + expected + "' is not a timestamp"));
            return a.compareTo(e);
        }
        throw new TypeMismatch(rule.operator() + " needs a numeric or timestamp attribute, got "
                + actual.getClass().getSimpleName());
    }

    private boolean inTimeWindow(Object actual, List<Object> values, Rule rule) {
        ZoneId zone = values.size() > 2 ? ZoneId.of(String.valueOf(values.get(2))) : ZoneOffset.UTC;
        LocalTime time;
        if (actual instanceof LocalTime localTime) {
            time = localTime;
        } else if (AttributeValues.isTemporal(actual)) {
            time = LocalTime.ofInstant(AttributeValues.asInstant(actual).orElseThrow(), zone);
        } else {
            throw new TypeMismatch("TIME_WINDOW needs a timestamp attribute, got "
                    + actual.getClass().getSimpleName());
        }
        LocalTime start = AttributeValues.asLocalTime(values.get(0))
                .orElseThrow(() -> new TypeMismatch("invalid window start in " + rule));
        LocalTime end = AttributeValues.asLocalTime(values.get(1))
                .orElseThrow(() -> new TypeMismatch("invalid window end in " + rule));

        if (!start.isAfter(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        // Window wraps past midnight
        return !time.isBefore(start) || time.isBefore(end);
    }

    private boolean inIpRange(Object actual, List<Object> values, Rule rule) {
        InetAddress address = AttributeValues.asAddress(actual)
                .orElseThrow(() -> new TypeMismatch("IP_RANGE needs an IP address attribute"));
        for (Object value : values) {
            if (CidrBlock.parse(String.valueOf(value)).contains(address)) {
                return true;
            }
        }
        return false;
    }

    private String text(Object actual, Rule rule) {
        if (actual instanceof CharSequence text) {
            return text.toString();
        }
        throw new TypeMismatch(rule.operator() + " needs a string attribute, got "
                + actual.getClass().getSimpleName());
    }

    private Pattern pattern(String regex) {
        return patternCache.computeIfAbsent(regex, Pattern::compile);
    }

    private static final class TypeMismatch extends RuntimeException {
        TypeMismatch(String message) {
            super(message, null, false, false);
        }
    }
}
