package com.di.logingest.exception;

/**
 * The policy evaluator failed or returned something that does not bind to the
 * expected output type.
 */
public class PolicyEvaluationException extends LogIngestException {

    public PolicyEvaluationException(String message) {
        super(message);
    }

    public PolicyEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
