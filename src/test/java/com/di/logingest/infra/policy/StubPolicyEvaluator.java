package com.di.logingest.infra.policy;

import com.di.logingest.exception.PolicyEvaluationException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * {@link PolicyEvaluator} test double. Each query path maps to a function of the input;
 * its result is bound to the requested type the same way an HTTP response would be.
 */
public class StubPolicyEvaluator implements PolicyEvaluator {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, Function<Object, Object>> rules = new ConcurrentHashMap<>();
    private final List<Object> inputs = new CopyOnWriteArrayList<>();

    public StubPolicyEvaluator rule(String queryPath, Function<Object, Object> rule) {
        rules.put(queryPath, rule);
        return this;
    }

    @Override
    public <T> T query(String queryPath, Object input, Class<T> type) {
        Function<Object, Object> rule = rules.get(queryPath);
        if (rule == null) {
            throw new PolicyEvaluationException("No rule for " + queryPath);
        }
        inputs.add(input);
        Object result = rule.apply(input);
        return mapper.convertValue(result == null ? Map.of() : result, type);
    }

    /** Every input seen, in call order. */
    public List<Object> getInputs() {
        return List.copyOf(inputs);
    }
}
