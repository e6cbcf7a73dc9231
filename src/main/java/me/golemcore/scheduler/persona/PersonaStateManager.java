package me.golemcore.scheduler.persona;

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
import me.golemcore.scheduler.domain.model.InboxEvent;
import me.golemcore.scheduler.domain.model.Mood;
import me.golemcore.scheduler.domain.model.PersonaStateSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Internal rhythm of one persona: energy, attention, derived mood, inbox load
 * and compute budget.
 *
 * <p>
 * Work depletes energy faster than rest restores it, so sustained load
 * eventually raises the engagement threshold and stretches the cadence. All
 * fields are clamped to {@code [0, 1]} after every transition.
 *
 * <p>
 * Only the owning persona's loop mutates this object. Methods are
 * synchronized so that diagnostic reads see a consistent snapshot.
 *
 * @since 1.0
 */
@Slf4j
public class PersonaStateManager {

    static final double HIGH_PRIORITY_THRESHOLD = 0.8;
    static final int OVERWHELMED_INBOX_LOAD = 50;
    static final double TIRED_ENERGY = 0.3;
    static final double ACTIVE_ENERGY = 0.5;
    static final double TIRED_MIN_ENERGY_TO_ENGAGE = 0.2;
    static final double FATIGUE_ATTENTION_DECAY = 0.9;
    static final double DEPLETION_MS = 10_000.0;
    static final double RECOVERY_MS = 20_000.0;

    private final String agentId;
    private final CadenceTable cadenceTable;
    private final Clock clock;

    private double energy = 1.0;
    private double attention = 1.0;
    private Mood mood = Mood.IDLE;
    private int inboxLoad;
    private Instant lastActivityTime;
    private long responseCount;
    private double computeBudget = 1.0;

    public PersonaStateManager(String agentId, CadenceTable cadenceTable, Clock clock) {
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.cadenceTable = Objects.requireNonNull(cadenceTable, "cadenceTable");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Account for a piece of work of the given duration and complexity.
     */
    public synchronized void recordActivity(Duration duration, double complexity) {
        double effort = clamp("complexity", complexity);
        energy = clamp("energy", energy - (toMillis(duration) / DEPLETION_MS) * effort);
        if (energy < TIRED_ENERGY) {
            attention = clamp("attention", attention * FATIGUE_ATTENTION_DECAY);
        }
        lastActivityTime = clock.instant();
        responseCount++;
        recomputeMood();
    }

    /**
     * Recover after resting for the given duration.
     */
    public synchronized void rest(Duration duration) {
        double recovered = toMillis(duration) / RECOVERY_MS;
        energy = clamp("energy", energy + recovered);
        attention = clamp("attention", attention + recovered * 2);
        recomputeMood();
    }

    public synchronized void updateInboxLoad(int load) {
        inboxLoad = Math.max(0, load);
        recomputeMood();
    }

    /**
     * External signal of remaining provider capacity, e.g. after hitting API
     * rate limits.
     */
    public synchronized void setComputeBudget(double budget) {
        computeBudget = clamp("computeBudget", budget);
    }

    public boolean shouldEngage(InboxEvent event) {
        return shouldEngage(event.getPriority());
    }

    /**
     * High-priority work is always taken; otherwise the bar rises with the
     * mood.
     */
    public synchronized boolean shouldEngage(double priority) {
        if (priority > HIGH_PRIORITY_THRESHOLD) {
            return true;
        }
        boolean aboveThreshold = priority > engagementThreshold();
        if (mood == Mood.TIRED) {
            return aboveThreshold && energy > TIRED_MIN_ENERGY_TO_ENGAGE;
        }
        return aboveThreshold;
    }

    /**
     * Minimum priority for engagement in the current mood. A persona that has
     * already responded keeps at least the active bar while idle, so that
     * losing energy never lowers the threshold.
     */
    public synchronized double engagementThreshold() {
        if (mood == Mood.IDLE && responseCount > 0) {
            return Mood.ACTIVE.getEngagementThreshold();
        }
        return mood.getEngagementThreshold();
    }

    public synchronized Duration getCadence() {
        Duration base = cadenceTable.baseFor(mood);
        if (computeBudget < cadenceTable.getLowBudgetThreshold()) {
            return base.multipliedBy(cadenceTable.getLowBudgetMultiplier());
        }
        return base;
    }

    public synchronized Mood getMood() {
        return mood;
    }

    public synchronized PersonaStateSnapshot getState() {
        return PersonaStateSnapshot.builder()
                .energy(energy)
                .attention(attention)
                .mood(mood)
                .inboxLoad(inboxLoad)
                .lastActivityTime(lastActivityTime)
                .responseCount(responseCount)
                .computeBudget(computeBudget)
                .build();
    }

    public String getAgentId() {
        return agentId;
    }

    private void recomputeMood() {
        Mood previous = mood;
        if (inboxLoad > OVERWHELMED_INBOX_LOAD) {
            mood = Mood.OVERWHELMED;
        } else if (energy < TIRED_ENERGY) {
            mood = Mood.TIRED;
        } else if (responseCount > 0 && energy > ACTIVE_ENERGY) {
            mood = Mood.ACTIVE;
        } else {
            mood = Mood.IDLE;
        }
        if (previous != mood) {
            log.debug("[PersonaState] {} mood {} -> {} (energy={}, load={})",
                    agentId, previous, mood, String.format("%.2f", energy), inboxLoad);
        }
    }

    private double clamp(String field, double value) {
        if (Double.isNaN(value)) {
            log.warn("[PersonaState] {} observed NaN {}, resetting to 0", agentId, field);
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double toMillis(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return 0.0;
        }
        return duration.toMillis();
    }
}
