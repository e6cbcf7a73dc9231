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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.RateLimitInfo;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Interval and session-cap based rate limiter for a single persona.
 *
 * <p>
 * Keeps one {@link ResponseRecord} per context in a concurrent map. Records
 * are replaced atomically through {@link Map#compute}, so the persona's loop
 * can write while diagnostics read.
 *
 * @since 1.0
 */
@Slf4j
public class ContextRateLimiter implements RateLimiter {

    private final String ownerId;
    private final RateLimitPolicy policy;
    private final Clock clock;

    private final Map<String, ResponseRecord> records = new ConcurrentHashMap<>();

    public ContextRateLimiter(String ownerId, RateLimitPolicy policy, Clock clock) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean isRateLimited(String contextId) {
        ResponseRecord record = records.get(contextId);
        if (record == null) {
            return false;
        }
        return remainingWait(record, clock.instant()).compareTo(Duration.ZERO) > 0
                || record.responseCount() >= policy.getMaxResponsesPerSession();
    }

    @Override
    public void recordResponse(String contextId) {
        Objects.requireNonNull(contextId, "contextId");
        Instant now = clock.instant();
        ResponseRecord updated = records.compute(contextId, (key, existing) -> existing == null
                ? new ResponseRecord(now, 1)
                : new ResponseRecord(now, existing.responseCount() + 1));
        if (updated.responseCount() == policy.getMaxResponsesPerSession()) {
            log.info("[RateLimiter] {} reached response cap ({}) in context {}",
                    ownerId, policy.getMaxResponsesPerSession(), contextId);
        }
    }

    @Override
    public void reset(String contextId) {
        if (records.remove(contextId) != null) {
            log.debug("[RateLimiter] {} reset context {}", ownerId, contextId);
        }
    }

    @Override
    public void resetAll() {
        records.clear();
        log.debug("[RateLimiter] {} reset all contexts", ownerId);
    }

    @Override
    public boolean hasReachedResponseCap(String contextId) {
        return getResponseCount(contextId) >= policy.getMaxResponsesPerSession();
    }

    @Override
    public long getResponseCount(String contextId) {
        ResponseRecord record = records.get(contextId);
        return record != null ? record.responseCount() : 0L;
    }

    @Override
    public RateLimitInfo getRateLimitInfo(String contextId) {
        return toInfo(contextId, records.get(contextId), clock.instant());
    }

    @Override
    public List<RateLimitInfo> getAllRateLimitInfo() {
        Instant now = clock.instant();
        return records.entrySet().stream()
                .map(entry -> toInfo(entry.getKey(), entry.getValue(), now))
                .sorted(Comparator.comparing(RateLimitInfo::getContextId))
                .toList();
    }

    @Override
    public RateLimitPolicy getPolicy() {
        return policy;
    }

    private RateLimitInfo toInfo(String contextId, ResponseRecord record, Instant now) {
        if (record == null) {
            return RateLimitInfo.builder()
                    .contextId(contextId)
                    .maxResponses(policy.getMaxResponsesPerSession())
                    .waitTime(Duration.ZERO)
                    .build();
        }
        Duration wait = remainingWait(record, now);
        boolean capReached = record.responseCount() >= policy.getMaxResponsesPerSession();
        return RateLimitInfo.builder()
                .contextId(contextId)
                .rateLimited(capReached || !wait.isZero())
                .responseCapReached(capReached)
                .responseCount(record.responseCount())
                .maxResponses(policy.getMaxResponsesPerSession())
                .lastResponseTime(record.lastResponseTime())
                .waitTime(wait)
                .build();
    }

    private Duration remainingWait(ResponseRecord record, Instant now) {
        Duration elapsed = Duration.between(record.lastResponseTime(), now);
        Duration remaining = policy.getMinIntervalBetweenResponses().minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private record ResponseRecord(Instant lastResponseTime, long responseCount) {
    }
}
