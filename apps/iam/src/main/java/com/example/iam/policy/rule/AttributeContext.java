package com.example.iam.policy.rule;

import java.util.Optional;

/**
 * Attribute lookup used by rule evaluation.
 *
 * <p>Paths are {@code subject.<name>}, {@code resource.<name>}, {@code environment.<name>}
 * or {@code action}. An attribute that is absent or null resolves to empty.
 */
public interface AttributeContext {

    Optional<Object> lookup(String path);
}
