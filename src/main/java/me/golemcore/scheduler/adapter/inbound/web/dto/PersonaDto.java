package me.golemcore.scheduler.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonaDto {
    private String id;
    private String role;
    private String status;
    private String mood;
    private double energy;
    private double attention;
    private double computeBudget;
    private long responseCount;
    private Instant lastActivityTime;
    private long cadenceMs;
    private int inboxDepth;
    private int inboxCapacity;
    private long droppedEvents;
    private long minResponseIntervalMs;
    private int maxResponsesPerSession;
    private List<RateLimitDto> rateLimits;

    public record RateLimitDto(String contextId, boolean rateLimited, boolean responseCapReached,
            long responseCount, long maxResponses, Instant lastResponseTime, long waitTimeMs) {
    }
}
