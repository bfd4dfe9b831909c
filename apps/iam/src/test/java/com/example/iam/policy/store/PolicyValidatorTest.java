package com.example.iam.policy.store;

import com.example.iam.common.exception.ValidationException;
import com.example.iam.policy.model.Effect;
import com.example.iam.policy.model.Operator;
import com.example.iam.policy.model.PolicyDefinition;
import com.example.iam.policy.model.Rule;
import com.example.iam.policy.model.RuleGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PolicyValidator")
class PolicyValidatorTest {

    private final PolicyValidator validator = new PolicyValidator();

    private static PolicyDefinition.Builder valid() {
        return PolicyDefinition.builder("deny-outside-office")
                .resourceType("document")
                .effect(Effect.DENY)
                .actions("write");
    }

    @Test
    @DisplayName("should accept a well-formed policy")
    void shouldAcceptValidPolicy() {
        PolicyDefinition definition = valid()
                .rules(Rule.of("environment.ip", Operator.IP_RANGE, "10.0.0.0/8", "192.168.0.0/16"),
                        Rule.of("environment.time", Operator.TIME_WINDOW, "08:00", "18:00", "Europe/Berlin"),
                        Rule.of("subject.clearance", Operator.IN_RANGE, 1, 5),
                        Rule.of("action", Operator.IN, "write", "delete"))
                .build();

        assertThatCode(() -> validator.validate(definition)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should reject missing resource type and effect")
    void shouldRejectMissingFields() {
        PolicyDefinition definition = new PolicyDefinition("p", "p", null, null, null,
                null, null, null, null, 0, true);

        assertThatThrownBy(() -> validator.validate(definition))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("resource type is required")
                .hasMessageContaining("effect is required");
    }

    @Test
    @DisplayName("should reject unknown attribute roots")
    void shouldRejectUnknownAttributePath() {
        PolicyDefinition definition = valid().rules(Rule.of("request.ip", Operator.EQUALS, "x")).build();

        assertThatThrownBy(() -> validator.validate(definition))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unknown attribute path");
    }

    @Test
    @DisplayName("should reject wrong operator arity")
    void shouldRejectArity() {
        PolicyDefinition definition = valid().rules(Rule.of("subject.clearance", Operator.IN_RANGE, 1)).build();

        assertThatThrownBy(() -> validator.validate(definition))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("IN_RANGE takes 2 value(s), got 1");
    }

    @Test
    @DisplayName("should reject inverted and mixed ranges")
    void shouldRejectBadRanges() {
        assertThatThrownBy(() -> validator.validate(
                valid().rules(Rule.of("subject.clearance", Operator.IN_RANGE, 5, 1)).build()))
                .hasMessageContaining("lower bound is greater");
        assertThatThrownBy(() -> validator.validate(
                valid().rules(Rule.of("subject.clearance", Operator.IN_RANGE, 1, "2024-01-01T00:00:00Z")).build()))
                .hasMessageContaining("both be numbers or both be timestamps");
    }

    @Test
    @DisplayName("should reject invalid CIDR, regex, time and zone values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> validator.validate(
                valid().rules(Rule.of("environment.ip", Operator.IP_RANGE, "10.0.0.0/40")).build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.validate(
                valid().rules(Rule.of("subject.name", Operator.REGEX, "([a-z")).build()))
                .hasMessageContaining("invalid regular expression");
        assertThatThrownBy(() -> validator.validate(
                valid().rules(Rule.of("environment.time", Operator.TIME_WINDOW, "25:00", "18:00")).build()))
                .hasMessageContaining("is not HH:mm");
        assertThatThrownBy(() -> validator.validate(
                valid().rules(Rule.of("environment.time", Operator.TIME_WINDOW, "08:00", "18:00", "Mars/Base")).build()))
                .hasMessageContaining("unknown time zone");
        assertThatThrownBy(() -> validator.validate(
                valid().rules(Rule.of("subject.clearance", Operator.GREATER_THAN, "high")).build()))
                .hasMessageContaining("needs a number or ISO-8601 timestamp");
    }

    @Test
    @DisplayName("should reject empty OR-groups and null values")
    void shouldRejectEmptyGroupsAndNulls() {
        PolicyDefinition emptyGroup = valid().anyOf(new RuleGroup(List.of())).build();
        PolicyDefinition nullValue = valid()
                .rules(new Rule("subject.department", Operator.EQUALS, Arrays.asList((Object) null)))
                .build();

        assertThatThrownBy(() -> validator.validate(emptyGroup))
                .hasMessageContaining("must contain at least one rule");
        assertThatThrownBy(() -> validator.validate(nullValue))
                .hasMessageContaining("values must not be null");
    }

    @Test
    @DisplayName("should report every problem at once")
    void shouldCollectAllErrors() {
        PolicyDefinition definition = valid()
                .rules(Rule.of("bogus", Operator.EQUALS, "x"),
                        Rule.of("subject.x", Operator.REGEX, "("))
                .build();

        assertThatThrownBy(() -> validator.validate(definition))
                .hasMessageContaining("rules[0]")
                .hasMessageContaining("rules[1]");
    }
}
