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

import java.time.Instant;
import java.util.Objects;

/**
 * An {@link InboxEvent} as held by one persona's inbox, together with its
 * arrival metadata. The {@code sequence} is a per-inbox monotonically
 * increasing arrival number used for FIFO tie-breaking among equal priorities.
 */
public record InboxEntry(InboxEvent event, Instant enqueuedAt, long sequence) {

    public InboxEntry {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    }

    public double priority() {
        return event.getPriority();
    }

    public String eventId() {
        return event.getId();
    }

    public String contextId() {
        return event.getContextId();
    }
}
