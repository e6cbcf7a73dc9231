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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.EnqueueOutcome;
import me.golemcore.scheduler.domain.model.InboxEntry;
import me.golemcore.scheduler.domain.model.InboxEvent;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link EventInbox} backed by a sorted set guarded by a single lock, with a
 * condition variable for {@link #pop(Duration)}.
 *
 * <p>
 * The set's first element is the highest-priority, earliest-arrived entry and
 * its last element is the eviction candidate, so enqueue, eviction and pop are
 * all {@code O(log n)}.
 *
 * @since 1.0
 */
@Slf4j
public class PriorityEventInbox implements EventInbox {

    static final Comparator<InboxEntry> PRIORITY_ORDER = Comparator
            .comparingDouble(InboxEntry::priority).reversed()
            .thenComparingLong(InboxEntry::sequence);

    private final String ownerId;
    private final int capacity;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final TreeSet<InboxEntry> entries = new TreeSet<>(PRIORITY_ORDER);
    private final Map<String, InboxEntry> entriesByEventId = new HashMap<>();

    private long nextSequence;
    private long droppedCount;
    private boolean closed;

    public PriorityEventInbox(String ownerId, int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Inbox capacity must be positive: " + capacity);
        }
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public EnqueueOutcome enqueue(InboxEvent event) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(event.getId(), "event.id");
        InboxEvent normalized = normalizePriority(event);

        lock.lock();
        try {
            if (closed) {
                droppedCount++;
                log.debug("[Inbox] {} closed, dropped event {}", ownerId, normalized.getId());
                return EnqueueOutcome.REJECTED;
            }
            if (entriesByEventId.containsKey(normalized.getId())) {
                log.debug("[Inbox] {} already holds event {}, ignoring duplicate", ownerId, normalized.getId());
                return EnqueueOutcome.REJECTED;
            }

            InboxEntry entry = new InboxEntry(normalized, clock.instant(), nextSequence++);
            if (entries.size() < capacity) {
                insert(entry);
                return EnqueueOutcome.ACCEPTED;
            }

            InboxEntry lowest = entries.last();
            if (entry.priority() <= lowest.priority()) {
                droppedCount++;
                log.debug("[Inbox] {} full ({}), dropped event {} (priority={} <= lowest={})",
                        ownerId, capacity, entry.eventId(), entry.priority(), lowest.priority());
                return EnqueueOutcome.REJECTED;
            }

            entries.pollLast();
            entriesByEventId.remove(lowest.eventId());
            droppedCount++;
            insert(entry);
            log.debug("[Inbox] {} full ({}), evicted event {} (priority={}) for {} (priority={})",
                    ownerId, capacity, lowest.eventId(), lowest.priority(), entry.eventId(), entry.priority());
            return EnqueueOutcome.ACCEPTED_WITH_EVICTION;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<InboxEntry> peek(int n) {
        if (n <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            List<InboxEntry> top = new ArrayList<>(Math.min(n, entries.size()));
            Iterator<InboxEntry> iterator = entries.iterator();
            while (iterator.hasNext() && top.size() < n) {
                top.add(iterator.next());
            }
            return top;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<InboxEntry> pop(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout != null ? timeout.toNanos() : 0L;
        lock.lockInterruptibly();
        try {
            while (entries.isEmpty()) {
                if (closed || remainingNanos <= 0L) {
                    return Optional.empty();
                }
                remainingNanos = notEmpty.awaitNanos(remainingNanos);
            }
            InboxEntry head = entries.pollFirst();
            entriesByEventId.remove(head.eventId());
            return Optional.of(head);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(InboxEntry entry) {
        if (entry == null) {
            return false;
        }
        lock.lock();
        try {
            InboxEntry current = entriesByEventId.get(entry.eventId());
            if (current == null || current.sequence() != entry.sequence()) {
                return false;
            }
            entries.remove(current);
            entriesByEventId.remove(current.eventId());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean reprioritize(String eventId, double priority) {
        lock.lock();
        try {
            InboxEntry current = entriesByEventId.get(eventId);
            if (current == null) {
                return false;
            }
            entries.remove(current);
            InboxEvent updated = normalizePriority(current.event().withPriority(priority));
            InboxEntry replacement = new InboxEntry(updated, current.enqueuedAt(), current.sequence());
            entries.add(replacement);
            entriesByEventId.put(eventId, replacement);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public long getDroppedCount() {
        lock.lock();
        try {
            return droppedCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("[Inbox] {} closed", ownerId);
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private void insert(InboxEntry entry) {
        entries.add(entry);
        entriesByEventId.put(entry.eventId(), entry);
        notEmpty.signal();
    }

    private InboxEvent normalizePriority(InboxEvent event) {
        double priority = event.getPriority();
        if (Double.isNaN(priority)) {
            throw new IllegalArgumentException("Event priority is NaN: " + event.getId());
        }
        if (priority < 0.0 || priority > 1.0) {
            log.debug("[Inbox] {} clamped priority {} of event {}", ownerId, priority, event.getId());
            return event.withPriority(Math.max(0.0, Math.min(1.0, priority)));
        }
        return event;
    }
}
