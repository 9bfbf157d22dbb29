package com.di.logingest.infra.policy;

import com.di.logingest.config.LogIngestProperties;
import com.di.logingest.exception.PolicyEvaluationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * {@link PolicyEvaluator} calling an OPA-compatible data API:
 * {@code POST {url}/v1/data/schema/cloudtrail} with {@code {"input": …}}, answering
 * {@code {"result": …}}. An undefined result binds as an empty object.
 */
@Component
@Slf4j
public class OpaPolicyEvaluator implements PolicyEvaluator {

    private static final String DATA_PREFIX = "data.";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public OpaPolicyEvaluator(RestTemplateBuilder builder,
                              ObjectMapper objectMapper,
                              LogIngestProperties properties) {
        LogIngestProperties.Policy policy = properties.getPolicy();
        this.restTemplate = builder
                .setConnectTimeout(policy.getConnectTimeout())
                .setReadTimeout(policy.getReadTimeout())
                .build();
        this.objectMapper = objectMapper;
        this.baseUrl = policy.getUrl().replaceAll("/+$", "");
    }

    @Override
    public <T> T query(String queryPath, Object input, Class<T> type) {
        String url = baseUrl + "/v1/data/" + toDocumentPath(queryPath);
        JsonNode response;
        try {
            response = restTemplate.postForObject(url, Map.of("input", input), JsonNode.class);
        } catch (RestClientException e) {
            throw new PolicyEvaluationException("Policy query " + queryPath + " failed", e);
        }

        JsonNode result = response == null ? null : response.get("result");
        if (result == null || result.isNull()) {
            log.debug("[POLICY] {} is undefined for the given input", queryPath);
            result = objectMapper.createObjectNode();
        }
        try {
            return objectMapper.treeToValue(result, type);
        } catch (Exception e) {
            throw new PolicyEvaluationException(
                    "Policy result of " + queryPath + " does not match " + type.getSimpleName(), e);
        }
    }

    static String toDocumentPath(String queryPath) {
        String path = queryPath.startsWith(DATA_PREFIX) ? queryPath.substring(DATA_PREFIX.length()) : queryPath;
        return path.replace('.', '/');
    }
}
