package com.di.logingest.infra.policy;

import com.di.logingest.config.LogIngestProperties;
import com.di.logingest.exception.PolicyEvaluationException;
import com.di.logingest.model.PolicyOutput;
import com.di.logingest.model.SourceOutput;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("OpaPolicyEvaluator Tests")
class OpaPolicyEvaluatorTest {

    private MockRestServiceServer server;
    private OpaPolicyEvaluator evaluator;

    @BeforeEach
    void setUp() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        LogIngestProperties properties = new LogIngestProperties();
        properties.getPolicy().setUrl("http://opa:8181/");
        evaluator = new OpaPolicyEvaluator(new RestTemplateBuilder(customizer), new ObjectMapper(), properties);
        server = customizer.getServer();
    }

    @Test
    @DisplayName("Should map query paths to data API document paths")
    void testToDocumentPath() {
        assertEquals("schema/cloudtrail", OpaPolicyEvaluator.toDocumentPath("data.schema.cloudtrail"));
        assertEquals("source", OpaPolicyEvaluator.toDocumentPath("data.source"));
        assertEquals("a/b", OpaPolicyEvaluator.toDocumentPath("a.b"));
    }

    @Test
    @DisplayName("Should post the input and bind the result")
    void testQuery() {
        server.expect(requestTo("http://opa:8181/v1/data/schema/cloudtrail"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.input.eventName").value("GetObject"))
                .andRespond(withSuccess(
                        "{\"result\":{\"log\":[{\"id\":\"e1\",\"timestamp\":1.5,\"dataset\":\"aws\","
                                + "\"table\":\"cloudtrail\",\"data\":{\"k\":\"v\"}}]}}",
                        MediaType.APPLICATION_JSON));

        PolicyOutput output = evaluator.query("data.schema.cloudtrail", Map.of("eventName", "GetObject"), PolicyOutput.class);

        assertEquals(1, output.getLogs().size());
        assertEquals("e1", output.getLogs().get(0).getId());
        assertEquals(1.5, output.getLogs().get(0).getTimestamp());
        server.verify();
    }

    @Test
    @DisplayName("Should bind an undefined result as an empty output")
    void testUndefinedResult() {
        server.expect(requestTo("http://opa:8181/v1/data/source"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        SourceOutput output = evaluator.query("data.source", Map.of(), SourceOutput.class);

        assertTrue(output.getSources().isEmpty());
    }

    @Test
    @DisplayName("Should raise a policy error when the endpoint fails")
    void testServerError() {
        server.expect(requestTo("http://opa:8181/v1/data/source")).andRespond(withServerError());

        assertThrows(PolicyEvaluationException.class,
                () -> evaluator.query("data.source", Map.of(), SourceOutput.class));
    }

    @Test
    @DisplayName("Should raise a policy error when the result has the wrong shape")
    void testWrongShape() {
        server.expect(requestTo("http://opa:8181/v1/data/schema/x"))
                .andRespond(withSuccess("{\"result\":{\"log\":\"not a list\"}}", MediaType.APPLICATION_JSON));

        assertThrows(PolicyEvaluationException.class,
                () -> evaluator.query("data.schema.x", Map.of(), PolicyOutput.class));
    }
}
