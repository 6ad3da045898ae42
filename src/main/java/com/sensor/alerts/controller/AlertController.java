package com.sensor.alerts.controller;

import com.sensor.alerts.model.AlertRequest;
import com.sensor.alerts.model.IngestionResult;
import com.sensor.alerts.service.AlertIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/alerts")
@Tag(name = "Alerts", description = "Submit device alerts for storage and push fan-out")
public class AlertController {

    private final AlertIngestionService ingestionService;

    public AlertController(AlertIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @Operation(summary = "Submit a device alert",
            description = "Validates the alert, rejects it if the sender is blocked, stores one record per " +
                    "non-blocked device owner and sends a push notification to each owner with a registered " +
                    "push token. Returns stored record ids and per-recipient push outcomes.")
    @PostMapping
    public ResponseEntity<?> submitAlert(@RequestBody AlertRequest request) {
        IngestionResult result = ingestionService.ingest(request);
        return switch (result.getStatus()) {
            case ACCEPTED -> ResponseEntity.ok(result.getResponse());
            case INVALID -> ResponseEntity.badRequest().body(result.getError());
            case SENDER_BLOCKED -> ResponseEntity.status(HttpStatus.FORBIDDEN).body(result.getError());
            case INTERNAL_ERROR -> ResponseEntity.internalServerError().body(result.getError());
        };
    }
}
