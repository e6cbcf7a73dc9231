package me.golemcore.scheduler.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An occurrence to fan out to personas.
 *
 * <p>
 * Priority is resolved per persona: an entry in {@code priorities} wins,
 * then {@code priority}, otherwise it is computed from the signals, with
 * {@code mentions} naming the personas addressed directly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestEventRequest {
    private String id;
    private String contextId;
    private String payload;
    private Instant timestamp;
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private Double priority;
    @Builder.Default
    private Map<String, Double> priorities = new LinkedHashMap<>();
    @Builder.Default
    private List<String> mentions = new ArrayList<>();
    private int recentRoomMessages;
    private boolean voice;
}
