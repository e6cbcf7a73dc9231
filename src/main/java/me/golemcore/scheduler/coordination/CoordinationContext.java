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

import me.golemcore.scheduler.domain.model.CoordinationPhase;
import me.golemcore.scheduler.domain.model.PersonaRole;
import me.golemcore.scheduler.domain.model.TurnDecision;
import me.golemcore.scheduler.domain.model.TurnIntent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Coordination state of one trigger. Every mutation happens while holding
 * this object's monitor; contexts of different triggers never share a lock.
 */
final class CoordinationContext {

    private final String triggerId;
    private final String contextId;
    private final Instant startedAt;
    private final Duration gatherWindow;
    private final int slots;

    private final Map<String, TurnIntent> intents = new LinkedHashMap<>();
    private final Map<String, TurnIntent> withdrawn = new LinkedHashMap<>();
    private final CompletableFuture<TurnDecision> decision = new CompletableFuture<>();

    private CoordinationPhase phase = CoordinationPhase.GATHERING;
    private ScheduledFuture<?> gatherTimer;

    CoordinationContext(String triggerId, String contextId, Instant startedAt, Duration gatherWindow, int slots) {
        this.triggerId = triggerId;
        this.contextId = contextId;
        this.startedAt = startedAt;
        this.gatherWindow = gatherWindow;
        this.slots = slots;
    }

    /**
     * Adds or refreshes an intent. A persona that re-registers keeps its
     * original position for tie-breaking.
     */
    void addIntent(String agentId, double confidence, PersonaRole role, Instant now, long sequence) {
        withdrawn.remove(agentId);
        TurnIntent existing = intents.get(agentId);
        long position = existing != null ? existing.sequence() : sequence;
        Instant registeredAt = existing != null ? existing.registeredAt() : now;
        intents.put(agentId, new TurnIntent(agentId, confidence, role, registeredAt, position));
    }

    boolean withdraw(String agentId) {
        TurnIntent removed = intents.remove(agentId);
        if (removed == null) {
            return false;
        }
        withdrawn.put(agentId, removed);
        return true;
    }

    boolean isGathering() {
        return phase == CoordinationPhase.GATHERING;
    }

    void markDeciding() {
        phase = CoordinationPhase.DECIDING;
        cancelTimer();
    }

    void complete(TurnDecision result) {
        phase = CoordinationPhase.DECIDED;
        decision.complete(result);
    }

    void cancelTimer() {
        if (gatherTimer != null) {
            gatherTimer.cancel(false);
            gatherTimer = null;
        }
    }

    boolean hasTimer() {
        return gatherTimer != null;
    }

    void setGatherTimer(ScheduledFuture<?> gatherTimer) {
        this.gatherTimer = gatherTimer;
    }

    List<TurnIntent> intentsSnapshot() {
        return new ArrayList<>(intents.values());
    }

    List<TurnIntent> withdrawnSnapshot() {
        return new ArrayList<>(withdrawn.values());
    }

    int intentCount() {
        return intents.size();
    }

    CompletableFuture<TurnDecision> decisionFuture() {
        return decision;
    }

    TurnDecision decisionOrNull() {
        return decision.getNow(null);
    }

    CoordinationPhase phase() {
        return phase;
    }

    String triggerId() {
        return triggerId;
    }

    String contextId() {
        return contextId;
    }

    Instant startedAt() {
        return startedAt;
    }

    Duration gatherWindow() {
        return gatherWindow;
    }

    int slots() {
        return slots;
    }
}
