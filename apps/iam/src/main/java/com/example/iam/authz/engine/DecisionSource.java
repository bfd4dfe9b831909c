package com.example.iam.authz.engine;

import java.util.List;

/**
 * One stage of the evaluation pipeline. Sources are independent of each other; the
 * {@link DenyOverridesCombiner} alone decides how their verdicts combine.
 */
public interface DecisionSource {

    String name();

    /**
     * @return verdicts in the order the source considers them; empty when the source has
     *         no opinion on the request
     */
    List<Verdict> evaluate(EvaluationContext context);
}
