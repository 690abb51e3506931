package com.parley.dispatch.api;

import com.parley.core.engine.Orchestrator;
import com.parley.core.model.InboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Entry point for chat-platform adapters running out of process.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private static final Logger log = LoggerFactory.getLogger(EventController.class);

    private final Orchestrator orchestrator;
    private final Clock clock;

    public EventController(Orchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    /**
     * POST /api/v1/events: accept an inbound conversational event.
     * Returns 202 once the event is queued; routing happens asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody EventRequest request) {
        if (!orchestrator.isRunning()) {
            return ResponseEntity.status(503).body(Map.of("error", "Orchestrator is not running"));
        }

        InboundEvent event;
        try {
            event = new InboundEvent(request.id(), request.conversationKey(), request.sender(),
                    request.senderName(), request.content(),
                    request.timestamp() != null ? request.timestamp() : clock.instant(),
                    request.messageType(), request.attachments(), request.quoted());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        orchestrator.accept(event).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Failed to route event {} for {}", event.id(), event.conversationKey(), error);
            }
        });
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "id", event.id()));
    }
}
