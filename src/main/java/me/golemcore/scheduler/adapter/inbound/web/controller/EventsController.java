package me.golemcore.scheduler.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.adapter.inbound.web.dto.IngestEventRequest;
import me.golemcore.scheduler.domain.model.EnqueueOutcome;
import me.golemcore.scheduler.domain.model.InboxEvent;
import me.golemcore.scheduler.domain.model.PrioritySignals;
import me.golemcore.scheduler.domain.service.MessagePriorityCalculator;
import me.golemcore.scheduler.domain.service.PersonaRuntimeService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Ingestion endpoint: fans an occurrence out to the persona inboxes with a
 * per-persona priority.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventsController {

    private final PersonaRuntimeService personaRuntimeService;
    private final MessagePriorityCalculator priorityCalculator;
    private final Clock clock;

    @PostMapping
    public Mono<ResponseEntity<EventAcceptedResponse>> ingest(@RequestBody IngestEventRequest request) {
        if (request == null || isBlank(request.getContextId())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "contextId is required");
        }
        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : clock.instant();
        double basePriority = request.getPriority() != null
                ? request.getPriority()
                : priorityCalculator.calculate(signals(request, timestamp, false));

        InboxEvent event = InboxEvent.builder()
                .id(isBlank(request.getId()) ? UUID.randomUUID().toString() : request.getId())
                .contextId(request.getContextId())
                .payload(request.getPayload())
                .metadata(request.getMetadata() != null ? request.getMetadata() : Map.of())
                .timestamp(timestamp)
                .priority(basePriority)
                .build();

        Map<String, EnqueueOutcome> outcomes = personaRuntimeService.broadcast(event,
                resolvePriorities(request, timestamp));

        Map<String, String> delivered = new LinkedHashMap<>();
        outcomes.forEach((agentId, outcome) -> delivered.put(agentId, outcome.name()));
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new EventAcceptedResponse(event.getId(), delivered)));
    }

    private Map<String, Double> resolvePriorities(IngestEventRequest request, Instant timestamp) {
        if (request.getPriorities() != null && !request.getPriorities().isEmpty()) {
            return request.getPriorities();
        }
        if (request.getPriority() != null) {
            return Map.of();
        }
        Map<String, Double> priorities = new LinkedHashMap<>();
        for (String agentId : personaRuntimeService.getPersonaIds()) {
            boolean mentioned = request.getMentions() != null && request.getMentions().contains(agentId);
            priorities.put(agentId, priorityCalculator.calculate(signals(request, timestamp, mentioned)));
        }
        return priorities;
    }

    private static PrioritySignals signals(IngestEventRequest request, Instant timestamp, boolean mentioned) {
        return PrioritySignals.builder()
                .mentioned(mentioned)
                .sentAt(timestamp)
                .recentRoomMessages(request.getRecentRoomMessages())
                .voice(request.isVoice())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    record EventAcceptedResponse(String eventId, Map<String, String> outcomes) {
    }
}
