package com.di.logingest.infra.policy;

/**
 * Evaluates a policy rule against an input document.
 *
 * <p>Implementations are deterministic for identical input. Any failure is thrown as
 * {@link com.di.logingest.exception.PolicyEvaluationException}.
 */
public interface PolicyEvaluator {

    /**
     * @param queryPath rule path such as {@code data.schema.cloudtrail}
     * @param input     decoded raw record or event
     * @param type      type the rule result binds to
     */
    <T> T query(String queryPath, Object input, Class<T> type);
}
