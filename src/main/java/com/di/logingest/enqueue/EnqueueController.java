package com.di.logingest.enqueue;

import com.di.logingest.enqueue.dto.EnqueueRequest;
import com.di.logingest.enqueue.dto.EnqueueResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/enqueue")
@Slf4j
@RequiredArgsConstructor
public class EnqueueController {

    private final EnqueueService enqueueService;

    @PostMapping
    public ResponseEntity<EnqueueResponse> enqueue(@Valid @RequestBody EnqueueRequest request) {
        log.info("[CONTROLLER] POST /api/enqueue urls={}", request.getUrls());
        return ResponseEntity.ok(enqueueService.enqueue(request));
    }
}
