package com.example.iam.policy.store;

import com.example.iam.common.exception.ValidationException;
import com.example.iam.common.util.StringSanitizer;
import com.example.iam.policy.model.Operator;
import com.example.iam.policy.model.PolicyDefinition;
import com.example.iam.policy.model.Rule;
import com.example.iam.policy.model.RuleGroup;
import com.example.iam.policy.rule.CidrBlock;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Structural validation of policy definitions. Collects every problem before failing
 * so a rejected write reports them all at once.
 */
@Component
public class PolicyValidator {

    private static final List<String> ATTRIBUTE_ROOTS = List.of("subject.", "resource.", "environment.");

    public void validate(PolicyDefinition definition) {
        List<String> errors = new ArrayList<>();

        if (!StringSanitizer.isValidId(definition.id())) {
            errors.add("invalid policy id '" + StringSanitizer.forLog(definition.id()) + "'");
        }
        if (definition.resourceType() == null || definition.resourceType().isBlank()) {
            errors.add("resource type is required");
        }
        if (definition.effect() == null) {
            errors.add("effect is required");
        }
        for (String action : definition.actions()) {
            if (action == null || action.isBlank()) {
                errors.add("actions must not contain blank entries");
            }
        }

        for (int i = 0; i < definition.rules().size(); i++) {
            validateRule(definition.rules().get(i), "rules[" + i + "]", errors);
        }
        for (int g = 0; g < definition.anyOf().size(); g++) {
            RuleGroup group = definition.anyOf().get(g);
            if (group.anyOf().isEmpty()) {
                errors.add("anyOf[" + g + "] must contain at least one rule");
            }
            for (int i = 0; i < group.anyOf().size(); i++) {
                validateRule(group.anyOf().get(i), "anyOf[" + g + "][" + i + "]", errors);
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Policy " + StringSanitizer.forLog(definition.id())
                    + " rejected: " + String.join("; ", errors));
        }
    }

    private void validateRule(Rule rule, String where, List<String> errors) {
        if (!isValidAttributePath(rule.attribute())) {
            errors.add(where + ": unknown attribute path '" + StringSanitizer.forLog(rule.attribute()) + "'");
        }

        Operator op = rule.operator();
        List<Object> values = rule.values();
        if (values.size() < op.minValues() || values.size() > op.maxValues()) {
            errors.add(where + ": " + op + " takes " + describeArity(op) + " value(s), got " + values.size());
            return;
        }
        if (values.stream().anyMatch(v -> v == null)) {
            errors.add(where + ": values must not be null");
            return;
        }

        switch (op) {
            case GREATER_THAN, LESS_THAN -> {
                if (!isComparable(values.get(0))) {
                    errors.add(where + ": " + op + " needs a number or ISO-8601 timestamp");
                }
            }
            case IN_RANGE -> validateRange(values, where, errors);
            case TIME_WINDOW -> validateTimeWindow(values, where, errors);
            case IP_RANGE -> values.forEach(v -> {
                try {
                    CidrBlock.parse(String.valueOf(v));
                } catch (ValidationException e) {
                    errors.add(where + ": " + e.getMessage());
                }
            });
            case REGEX -> {
                try {
                    Pattern.compile(String.valueOf(values.get(0)));
                } catch (PatternSyntaxException e) {
                    errors.add(where + ": invalid regular expression: " + e.getDescription());
                }
            }
            default -> {
                // No value constraints beyond arity
            }
        }
    }

    private void validateRange(List<Object> values, String where, List<String> errors) {
        Object min = values.get(0);
        Object max = values.get(1);
        BigDecimal minNumber = number(min);
        BigDecimal maxNumber = number(max);
        if (minNumber != null && maxNumber != null) {
            if (minNumber.compareTo(maxNumber) > 0) {
                errors.add(where + ": IN_RANGE lower bound is greater than upper bound");
            }
            return;
        }
        Instant minInstant = instant(min);
        Instant maxInstant = instant(max);
        if (minInstant != null && maxInstant != null) {
            if (minInstant.isAfter(maxInstant)) {
                errors.add(where + ": IN_RANGE lower bound is after upper bound");
            }
            return;
        }
        errors.add(where + ": IN_RANGE bounds must both be numbers or both be timestamps");
    }

    private void validateTimeWindow(List<Object> values, String where, List<String> errors) {
        for (int i = 0; i < 2; i++) {
            try {
                LocalTime.parse(String.valueOf(values.get(i)));
            } catch (DateTimeParseException e) {
                errors.add(where + ": TIME_WINDOW bound '" + values.get(i) + "' is not HH:mm[:ss]");
            }
        }
        if (values.size() > 2) {
            try {
                ZoneId.of(String.valueOf(values.get(2)));
            } catch (DateTimeException e) {
                errors.add(where + ": unknown time zone '" + values.get(2) + "'");
            }
        }
    }

    private static boolean isValidAttributePath(String path) {
        if ("action".equals(path)) {
            return true;
        }
        return ATTRIBUTE_ROOTS.stream()
                .anyMatch(root -> path.startsWith(root) && path.length() > root.length());
    }

    private static boolean isComparable(Object value) {
        return number(value) != null || instant(value) != null;
    }

    private static BigDecimal number(Object value) {
        try {
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Instant instant(Object value) {
        if (value instanceof Instant i) {
            return i;
        }
        try {
            return Instant.parse(String.valueOf(value).trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String describeArity(Operator op) {
        if (op.minValues() == op.maxValues()) {
            return String.valueOf(op.minValues());
        }
        return op.maxValues() == Integer.MAX_VALUE ? "at least " + op.minValues()
                : op.minValues() + ".." + op.maxValues();
    }
}
