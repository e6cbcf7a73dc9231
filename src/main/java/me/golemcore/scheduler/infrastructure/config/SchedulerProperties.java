package me.golemcore.scheduler.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Data;
import me.golemcore.scheduler.domain.model.PersonaRole;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scheduler configuration bound from application.properties.
 *
 * <p>
 * Everything lives under the {@code scheduler.*} prefix:
 * <ul>
 * <li>{@link InboxProperties} - per-persona inbox capacity</li>
 * <li>{@link RateLimitProperties} - per-context response spacing and cap</li>
 * <li>{@link CadenceProperties} - rest duration per mood</li>
 * <li>{@link LoopProperties} - scheduler loop tuning</li>
 * <li>{@link CoordinationProperties} - turn arbitration</li>
 * <li>{@link PersonaProperties} - personas started with the application, each
 * optionally overriding inbox capacity, rate limits and cadence</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "scheduler")
@Data
public class SchedulerProperties {

    private boolean enabled = true;
    private List<PersonaProperties> personas = new ArrayList<>();
    private InboxProperties inbox = new InboxProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private CadenceProperties cadence = new CadenceProperties();
    private LoopProperties loop = new LoopProperties();
    private CoordinationProperties coordination = new CoordinationProperties();

    @Data
    public static class PersonaProperties {
        private String id;
        private PersonaRole role = PersonaRole.PARTICIPANT;
        private double computeBudget = 1.0;
        /** Unset values fall back to {@code scheduler.inbox.capacity}. */
        private Integer inboxCapacity;
        private RateLimitOverrides rateLimit = new RateLimitOverrides();
        private CadenceOverrides cadence = new CadenceOverrides();
    }

    @Data
    public static class RateLimitOverrides {
        private Integer minSecondsBetweenResponses;
        private Integer maxResponsesPerSession;
    }

    @Data
    public static class CadenceOverrides {
        private Duration overwhelmed;
        private Duration tired;
        private Duration active;
        private Duration idle;
    }

    @Data
    public static class InboxProperties {
        private int capacity = 1000;
    }

    @Data
    public static class RateLimitProperties {
        private int minSecondsBetweenResponses = 10;
        private int maxResponsesPerSession = 50;
    }

    @Data
    public static class CadenceProperties {
        private Duration overwhelmed = Duration.ofSeconds(10);
        private Duration tired = Duration.ofSeconds(7);
        private Duration active = Duration.ofSeconds(5);
        private Duration idle = Duration.ofSeconds(3);
        private double lowBudgetThreshold = 0.5;
        private long lowBudgetMultiplier = 2;
    }

    @Data
    public static class LoopProperties {
        private int peekCount = 5;
        private long failureBackoffMultiplier = 2;
        private Duration turnRequestTimeout = Duration.ofSeconds(25);
        private Duration minimumActivityDuration = Duration.ofSeconds(3);
    }

    @Data
    public static class CoordinationProperties {
        private int maxResponders = 1;
        private boolean probabilisticFanOut = false;
        private Duration minGatherWindow = Duration.ofSeconds(2);
        private Duration maxGatherWindow = Duration.ofSeconds(20);
        private Duration initialLatency = Duration.ofSeconds(4);
        private double latencyFactor = 1.0;
        private double latencySmoothing = 0.3;
        private double earlyDecisionConfidence = 0.9;
        private double minConfidence = 0.3;
        private double lowConfidenceFloor = 0.2;
        private double lowConfidenceAverage = 0.4;
        private double maxRecencyPenalty = 0.5;
        private int recentResponderHistory = 10;
        private Duration retention = Duration.ofMinutes(5);
        private Duration cleanupInterval = Duration.ofSeconds(30);
    }
}
