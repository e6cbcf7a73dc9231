package me.golemcore.scheduler.inbox;

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

import me.golemcore.scheduler.domain.model.EnqueueOutcome;
import me.golemcore.scheduler.domain.model.InboxEntry;
import me.golemcore.scheduler.domain.model.InboxEvent;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Bounded per-persona queue of pending events, ordered by descending priority
 * with FIFO tie-breaking.
 *
 * <p>
 * When full, an incoming event either displaces the current lowest-priority
 * entry (if it strictly outranks it) or is dropped. Dropping is the intended
 * backpressure mechanism and is not reported as an error.
 *
 * <p>
 * {@link #pop(Duration)} is the only blocking operation; it is bounded by its
 * timeout and returns early when the inbox is closed or the calling thread is
 * interrupted.
 *
 * @since 1.0
 * @see PriorityEventInbox
 */
public interface EventInbox {

    /**
     * Offer an event. Never blocks.
     */
    EnqueueOutcome enqueue(InboxEvent event);

    /**
     * Top {@code n} entries by priority without removing them. Never blocks.
     */
    List<InboxEntry> peek(int n);

    /**
     * Remove and return the highest-priority entry, waiting up to
     * {@code timeout} for one to arrive.
     */
    Optional<InboxEntry> pop(Duration timeout) throws InterruptedException;

    /**
     * Remove exactly the given entry if it is still queued.
     */
    boolean remove(InboxEntry entry);

    /**
     * Replace the priority of a queued event, keeping its arrival position
     * for tie-breaking.
     */
    boolean reprioritize(String eventId, double priority);

    int size();

    int getCapacity();

    /**
     * Events rejected or evicted since creation.
     */
    long getDroppedCount();

    /**
     * Wake all waiters and refuse further events.
     */
    void close();

    boolean isClosed();
}
