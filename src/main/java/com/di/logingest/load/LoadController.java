package com.di.logingest.load;

import com.di.logingest.enqueue.dto.EnqueueMessage;
import com.di.logingest.load.dto.LoadApiRequest;
import com.di.logingest.load.dto.LoadObjectRequest;
import com.di.logingest.load.dto.PubSubPushRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Base64;
import java.util.List;

/**
 * REST entry points of the load pipeline.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/api/load</td><td>Load explicit object + source pairs</td></tr>
 * <tr><td>POST</td><td>/api/load/object</td><td>Load one object, sources chosen by policy</td></tr>
 * <tr><td>POST</td><td>/api/pubsub/push</td><td>Consume an enqueued batch pushed by Pub/Sub</td></tr>
 * </table>
 *
 * All endpoints are synchronous. Failures are rendered by the global exception handler.
 */
@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class LoadController {

    private final LoadService  loadService;
    private final ObjectMapper objectMapper;

    @PostMapping("/load")
    public ResponseEntity<LoadResult> load(@Valid @RequestBody LoadApiRequest request) {
        log.info("[CONTROLLER] POST /api/load requests={}", request.getRequests().size());
        return ResponseEntity.ok(loadService.load(request.toLoadRequests()));
    }

    @PostMapping("/load/object")
    public ResponseEntity<LoadResult> loadObject(@Valid @RequestBody LoadObjectRequest request) {
        log.info("[CONTROLLER] POST /api/load/object url={}", request.getUrl());
        return ResponseEntity.ok(loadService.loadObject(request.getUrl()));
    }

    @PostMapping("/pubsub/push")
    public ResponseEntity<List<LoadResult>> push(@Valid @RequestBody PubSubPushRequest request) {
        EnqueueMessage message = decode(request.getMessage());
        log.info("[CONTROLLER] POST /api/pubsub/push messageId={} objects={}",
                 request.getMessage().getMessageId(), message.getObjects().size());
        return ResponseEntity.ok(loadService.loadObjects(message.getObjects()));
    }

    private EnqueueMessage decode(PubSubPushRequest.Message message) {
        try {
            byte[] payload = Base64.getDecoder().decode(message.getData());
            return objectMapper.readValue(payload, EnqueueMessage.class);
        } catch (IllegalArgumentException | IOException e) {
            throw new IllegalArgumentException("Invalid push message " + message.getMessageId(), e);
        }
    }
}
