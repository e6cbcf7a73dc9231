package me.golemcore.scheduler.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.coordination.TurnCoordinator;
import me.golemcore.scheduler.domain.model.CoordinationPhase;
import me.golemcore.scheduler.domain.model.CoordinationStats;
import me.golemcore.scheduler.domain.model.TurnDecision;
import me.golemcore.scheduler.domain.model.TurnRejection;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Diagnostics of turn arbitration: aggregate statistics and per-trigger
 * decisions.
 */
@RestController
@RequestMapping("/api/coordination")
@RequiredArgsConstructor
public class CoordinationController {

    private final TurnCoordinator turnCoordinator;

    @GetMapping("/stats")
    public Mono<ResponseEntity<StatsResponse>> getStats() {
        CoordinationStats stats = turnCoordinator.getCoordinationStats();
        StatsResponse response = new StatsResponse(
                stats.getActiveContexts(),
                stats.getGatheringContexts(),
                stats.getDecidedContexts(),
                stats.getTotalDecisions(),
                stats.getTotalRejections(),
                stats.getRejectionsByReason(),
                stats.getRejectionsByRole(),
                stats.getAverageIntentsPerDecision(),
                stats.getCurrentGatherWindow().toMillis());
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/triggers/{triggerId}")
    public Mono<ResponseEntity<TriggerResponse>> getTrigger(@PathVariable String triggerId) {
        CoordinationPhase phase = turnCoordinator.getPhase(triggerId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No coordination context for trigger: " + triggerId));
        TurnDecision decision = turnCoordinator.getDecision(triggerId).orElse(null);
        return Mono.just(ResponseEntity.ok(toResponse(triggerId, phase, decision)));
    }

    private static TriggerResponse toResponse(String triggerId, CoordinationPhase phase, TurnDecision decision) {
        if (decision == null) {
            return new TriggerResponse(triggerId, null, phase.name(), List.of(), List.of(), List.of(), 0, null,
                    null, 0);
        }
        List<RejectionDto> rejections = decision.getRejections().stream()
                .map(CoordinationController::toDto)
                .toList();
        return new TriggerResponse(
                triggerId,
                decision.getContextId(),
                phase.name(),
                decision.getGranted(),
                decision.getDenied(),
                rejections,
                decision.getSlots(),
                decision.getReasoning(),
                decision.getDecidedAt(),
                decision.getCoordinationDuration().toMillis());
    }

    private static RejectionDto toDto(TurnRejection rejection) {
        return new RejectionDto(rejection.agentId(), rejection.reason().name(), rejection.confidence(),
                rejection.role().name(), rejection.details());
    }

    record StatsResponse(int activeContexts, int gatheringContexts, int decidedContexts, long totalDecisions,
            long totalRejections, Map<?, Long> rejectionsByReason, Map<?, Long> rejectionsByRole,
            double averageIntentsPerDecision, long currentGatherWindowMs) {
    }

    record TriggerResponse(String triggerId, String contextId, String phase, List<String> granted,
            List<String> denied, List<RejectionDto> rejections, int slots, String reasoning, Instant decidedAt,
            long coordinationDurationMs) {
    }

    record RejectionDto(String agentId, String reason, double confidence, String role, String details) {
    }
}
