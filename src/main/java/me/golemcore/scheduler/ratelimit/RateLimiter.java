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

import me.golemcore.scheduler.domain.model.RateLimitInfo;

import java.util.List;

/**
 * Per-persona response throttle keyed by conversation context.
 *
 * <p>
 * A context is rate limited when either:
 * <ul>
 * <li>less than the minimum spacing has elapsed since the last response, or</li>
 * <li>the response count for the current session reached the cap.</li>
 * </ul>
 *
 * <p>
 * Each persona owns its own instance; session boundaries (room leave,
 * shutdown) are signalled by calling {@link #reset(String)} or
 * {@link #resetAll()}.
 *
 * @since 1.0
 * @see ContextRateLimiter
 */
public interface RateLimiter {

    boolean isRateLimited(String contextId);

    /**
     * Record one successful dispatch in the context.
     */
    void recordResponse(String contextId);

    void reset(String contextId);

    void resetAll();

    boolean hasReachedResponseCap(String contextId);

    long getResponseCount(String contextId);

    /**
     * Immutable snapshot of the record for a context.
     */
    RateLimitInfo getRateLimitInfo(String contextId);

    /**
     * Snapshots of every context with recorded responses.
     */
    List<RateLimitInfo> getAllRateLimitInfo();

    RateLimitPolicy getPolicy();
}
