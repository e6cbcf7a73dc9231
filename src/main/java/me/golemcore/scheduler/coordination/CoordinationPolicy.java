package me.golemcore.scheduler.coordination;

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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable settings of the {@link TurnCoordinator}.
 *
 * @since 1.0
 */
@Value
@Builder
public class CoordinationPolicy {

    /** Fan-out limit K: how many personas may act on one trigger. */
    @Builder.Default
    int maxResponders = 1;

    /** Draw K per trigger (1: 70%, 2: 25%, 3: 5%), capped by maxResponders. */
    @Builder.Default
    boolean probabilisticFanOut = false;

    @Builder.Default
    Duration minGatherWindow = Duration.ofSeconds(2);
    @Builder.Default
    Duration maxGatherWindow = Duration.ofSeconds(20);

    /** Latency assumed before any response has been observed. */
    @Builder.Default
    Duration initialLatency = Duration.ofSeconds(4);

    /** Gather window as a multiple of the smoothed response latency. */
    @Builder.Default
    double latencyFactor = 1.0;

    /** EWMA weight of the newest latency sample. */
    @Builder.Default
    double latencySmoothing = 0.3;

    /** An intent at or above this confidence plus one more closes gathering early. */
    @Builder.Default
    double earlyDecisionConfidence = 0.9;

    @Builder.Default
    double minConfidence = 0.3;

    /** Threshold used instead of minConfidence when all intents are weak. */
    @Builder.Default
    double lowConfidenceFloor = 0.2;

    /** Average confidence under which the floor applies. */
    @Builder.Default
    double lowConfidenceAverage = 0.4;

    @Builder.Default
    double maxRecencyPenalty = 0.5;

    @Builder.Default
    int recentResponderHistory = 10;

    /** How long decided contexts are kept for late arrivals. */
    @Builder.Default
    Duration retention = Duration.ofMinutes(5);

    @Builder.Default
    Duration cleanupInterval = Duration.ofSeconds(30);

    public static CoordinationPolicy defaults() {
        return CoordinationPolicy.builder().build();
    }
}
