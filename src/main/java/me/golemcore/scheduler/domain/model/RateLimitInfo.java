package me.golemcore.scheduler.domain.model;

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
import java.time.Instant;

/**
 * Rate limit bookkeeping for one (persona, context) pair.
 *
 * <p>
 * {@code waitTime} is the remaining cool-down before the minimum spacing
 * between responses has elapsed; it is {@link Duration#ZERO} once it has.
 *
 * @since 1.0
 */
@Value
@Builder
public class RateLimitInfo {

    String contextId;
    boolean rateLimited;
    boolean responseCapReached;
    long responseCount;
    long maxResponses;
    Instant lastResponseTime;
    Duration waitTime;
}
