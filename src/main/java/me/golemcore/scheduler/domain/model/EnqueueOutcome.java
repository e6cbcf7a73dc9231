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

/**
 * Outcome of offering an event to a bounded inbox.
 */
public enum EnqueueOutcome {

    /** Queued without displacing anything. */
    ACCEPTED,

    /** Queued after evicting the lowest-priority entry. */
    ACCEPTED_WITH_EVICTION,

    /** Inbox full and the event did not outrank the lowest entry; dropped. */
    REJECTED;

    public boolean isAccepted() {
        return this != REJECTED;
    }
}
