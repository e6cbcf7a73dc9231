package me.golemcore.scheduler.ratelimit;

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

import lombok.Value;

import java.time.Duration;

/**
 * Immutable rate limit settings for one persona.
 */
@Value
public class RateLimitPolicy {

    public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_RESPONSES_PER_SESSION = 50;

    Duration minIntervalBetweenResponses;
    int maxResponsesPerSession;

    public RateLimitPolicy(Duration minIntervalBetweenResponses, int maxResponsesPerSession) {
        if (minIntervalBetweenResponses == null || minIntervalBetweenResponses.isNegative()) {
            throw new IllegalArgumentException("Minimum interval must be non-negative");
        }
        if (maxResponsesPerSession <= 0) {
            throw new IllegalArgumentException("Max responses per session must be positive");
        }
        this.minIntervalBetweenResponses = minIntervalBetweenResponses;
        this.maxResponsesPerSession = maxResponsesPerSession;
    }

    public static RateLimitPolicy defaults() {
        return new RateLimitPolicy(DEFAULT_MIN_INTERVAL, DEFAULT_MAX_RESPONSES_PER_SESSION);
    }
}
