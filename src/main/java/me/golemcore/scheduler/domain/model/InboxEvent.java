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

import java.time.Instant;
import java.util.Map;

/**
 * An occurrence a persona may act on, for example a chat message posted to a
 * room.
 *
 * <p>
 * Events are immutable. The {@code priority} is computed by the ingestion side
 * for one specific persona (mentions, recency, relevance) and lies in
 * {@code [0, 1]}. When an event is re-evaluated after a delay a new instance is
 * produced via {@link #withPriority(double)}.
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
public class InboxEvent {

    String id;
    String contextId;
    String payload;
    Map<String, Object> metadata;
    Instant timestamp;
    double priority;

    public InboxEvent withPriority(double newPriority) {
        return toBuilder().priority(newPriority).build();
    }
}
