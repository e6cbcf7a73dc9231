package me.golemcore.scheduler.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.adapter.inbound.web.dto.PersonaDto;
import me.golemcore.scheduler.domain.model.PersonaInspection;
import me.golemcore.scheduler.domain.model.PersonaStateSnapshot;
import me.golemcore.scheduler.domain.model.RateLimitInfo;
import me.golemcore.scheduler.domain.service.PersonaRuntimeService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Read-only view of the persona pool: state, inbox depth and rate limits.
 */
@RestController
@RequestMapping("/api/personas")
@RequiredArgsConstructor
public class PersonasController {

    private final PersonaRuntimeService personaRuntimeService;

    @GetMapping
    public Mono<ResponseEntity<List<PersonaDto>>> listPersonas() {
        List<PersonaDto> personas = personaRuntimeService.inspectAll().stream()
                .map(PersonasController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(personas));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<PersonaDto>> getPersona(@PathVariable String id) {
        PersonaInspection inspection = personaRuntimeService.inspect(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Persona not found: " + id));
        return Mono.just(ResponseEntity.ok(toDto(inspection)));
    }

    private static PersonaDto toDto(PersonaInspection inspection) {
        PersonaStateSnapshot state = inspection.getState();
        List<PersonaDto.RateLimitDto> rateLimits = inspection.getRateLimits().stream()
                .map(PersonasController::toDto)
                .toList();
        return PersonaDto.builder()
                .id(inspection.getAgentId())
                .role(inspection.getRole().name())
                .status(inspection.getStatus().name())
                .mood(state.getMood().name())
                .energy(state.getEnergy())
                .attention(state.getAttention())
                .computeBudget(state.getComputeBudget())
                .responseCount(state.getResponseCount())
                .lastActivityTime(state.getLastActivityTime())
                .cadenceMs(toMillis(inspection.getCadence()))
                .inboxDepth(inspection.getInboxDepth())
                .inboxCapacity(inspection.getInboxCapacity())
                .droppedEvents(inspection.getDroppedEvents())
                .minResponseIntervalMs(toMillis(inspection.getMinResponseInterval()))
                .maxResponsesPerSession(inspection.getMaxResponsesPerSession())
                .rateLimits(rateLimits)
                .build();
    }

    private static PersonaDto.RateLimitDto toDto(RateLimitInfo info) {
        return new PersonaDto.RateLimitDto(info.getContextId(), info.isRateLimited(), info.isResponseCapReached(),
                info.getResponseCount(), info.getMaxResponses(), info.getLastResponseTime(),
                toMillis(info.getWaitTime()));
    }

    private static long toMillis(Duration duration) {
        return duration != null ? duration.toMillis() : 0;
    }
}
