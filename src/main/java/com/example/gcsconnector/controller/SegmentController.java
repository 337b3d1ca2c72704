package com.example.gcsconnector.controller;

import com.example.gcsconnector.model.SegmentClosedNotification;
import com.example.gcsconnector.model.UploaderStatus;
import com.example.gcsconnector.service.ConnectorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Paths;
import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SegmentController {

    private final ConnectorService connectorService;

    @PostMapping("/segments")
    public ResponseEntity<Void> segmentClosed(@RequestBody SegmentClosedNotification notification) {
        if (!StringUtils.hasText(notification.path())) {
            throw new IllegalArgumentException("path is required");
        }
        connectorService.onSegmentClosed(notification.output(), Paths.get(notification.path()));
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/uploaders")
    public List<UploaderStatus> uploaders() {
        return connectorService.statuses();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> badRequest(IllegalArgumentException e) {
        log.warn("Rejected segment notification: {}", e.getMessage());
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}
