package com.example.changefeed.controller;

import com.example.changefeed.model.dto.ChangeEvent;
import com.example.changefeed.model.dto.EnqueueResult;
import com.example.changefeed.queue.ChangeEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Enqueue endpoint for the CRUD write path.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/change-events")
@RequiredArgsConstructor
public class ChangeEventController {

    private final ChangeEventPublisher publisher;

    @PostMapping
    public ResponseEntity<EnqueueResult> enqueue(@RequestBody ChangeEvent event) {
        EnqueueResult result = publisher.enqueueChangeEvent(event);
        HttpStatus status = result.accepted() ? HttpStatus.ACCEPTED : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(result);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<EnqueueResult> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable change event: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(EnqueueResult.rejected("malformed change event"));
    }
}
