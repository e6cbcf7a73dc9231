package me.golemcore.scheduler.persona;

import me.golemcore.scheduler.domain.model.InboxEvent;
import me.golemcore.scheduler.domain.model.Mood;
import me.golemcore.scheduler.domain.model.PersonaStateSnapshot;
import me.golemcore.scheduler.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PersonaStateManagerTest {

    private MutableClock clock;
    private PersonaStateManager state;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        state = new PersonaStateManager("helper", CadenceTable.defaults(), clock);
    }

    @Test
    void shouldStartRestedAndIdle() {
        PersonaStateSnapshot snapshot = state.getState();

        assertEquals(1.0, snapshot.getEnergy());
        assertEquals(1.0, snapshot.getAttention());
        assertEquals(Mood.IDLE, snapshot.getMood());
        assertEquals(0, snapshot.getResponseCount());
        assertNull(snapshot.getLastActivityTime());
        assertEquals(Duration.ofSeconds(3), state.getCadence());
    }

    @Test
    void shouldDepleteEnergyProportionallyToDurationAndComplexity() {
        state.recordActivity(Duration.ofSeconds(5), 0.5);

        PersonaStateSnapshot snapshot = state.getState();
        assertEquals(0.75, snapshot.getEnergy(), 1e-9);
        assertEquals(1, snapshot.getResponseCount());
        assertEquals(clock.instant(), snapshot.getLastActivityTime());
        assertEquals(Mood.ACTIVE, snapshot.getMood());
    }

    @Test
    void shouldBecomeTiredAndLoseAttentionWhenEnergyDropsLow() {
        state.recordActivity(Duration.ofSeconds(8), 1.0);

        PersonaStateSnapshot snapshot = state.getState();
        assertEquals(0.2, snapshot.getEnergy(), 1e-9);
        assertEquals(0.9, snapshot.getAttention(), 1e-9);
        assertEquals(Mood.TIRED, snapshot.getMood());
        assertEquals(Duration.ofSeconds(7), state.getCadence());
    }

    @Test
    void shouldClampEnergyAtZero() {
        state.recordActivity(Duration.ofMinutes(5), 1.0);

        assertEquals(0.0, state.getState().getEnergy());
    }

    @Test
    void shouldRecoverEnergyAndAttentionWhileResting() {
        state.recordActivity(Duration.ofSeconds(8), 1.0);

        state.rest(Duration.ofSeconds(4));

        PersonaStateSnapshot snapshot = state.getState();
        assertEquals(0.4, snapshot.getEnergy(), 1e-9);
        assertEquals(1.0, snapshot.getAttention(), 1e-9);

        state.rest(Duration.ofMinutes(10));
        assertEquals(1.0, state.getState().getEnergy());
    }

    @Test
    void shouldBeOverwhelmedWhenInboxLoadExceedsFifty() {
        state.updateInboxLoad(50);
        assertEquals(Mood.IDLE, state.getMood());

        state.updateInboxLoad(51);
        assertEquals(Mood.OVERWHELMED, state.getMood());
        assertEquals(Duration.ofSeconds(10), state.getCadence());

        state.updateInboxLoad(0);
        assertEquals(Mood.IDLE, state.getMood());
    }

    @Test
    void shouldAlwaysEngageWithHighPriorityRegardlessOfMood() {
        state.updateInboxLoad(200);
        assertEquals(Mood.OVERWHELMED, state.getMood());
        assertTrue(state.shouldEngage(0.85));

        state.updateInboxLoad(0);
        state.recordActivity(Duration.ofMinutes(5), 1.0);
        assertEquals(Mood.TIRED, state.getMood());
        assertTrue(state.shouldEngage(0.81));
    }

    @Test
    void shouldApplyMoodThresholds() {
        assertTrue(state.shouldEngage(0.11));
        assertFalse(state.shouldEngage(0.1));

        state.recordActivity(Duration.ofSeconds(1), 0.5);
        assertEquals(Mood.ACTIVE, state.getMood());
        assertTrue(state.shouldEngage(0.31));
        assertFalse(state.shouldEngage(0.3));

        state.updateInboxLoad(60);
        assertEquals(Mood.OVERWHELMED, state.getMood());
        assertFalse(state.shouldEngage(0.8));
    }

    @Test
    void shouldRequireEnergyWhenTired() {
        state.recordActivity(Duration.ofMillis(7500), 1.0);
        assertEquals(Mood.TIRED, state.getMood());
        assertTrue(state.shouldEngage(0.6));

        state.recordActivity(Duration.ofMillis(1000), 1.0);
        assertEquals(0.15, state.getState().getEnergy(), 1e-9);
        assertFalse(state.shouldEngage(0.6));
    }

    @Test
    void shouldNeverLowerThresholdAsEnergyFalls() {
        double previous = state.engagementThreshold();
        for (int i = 0; i < 20; i++) {
            state.recordActivity(Duration.ofMillis(600), 1.0);
            double current = state.engagementThreshold();
            assertTrue(current >= previous,
                    "threshold dropped from " + previous + " to " + current + " at step " + i);
            previous = current;
        }
    }

    @Test
    void shouldEngageWithEventByItsPriority() {
        InboxEvent event = InboxEvent.builder().id("e1").contextId("room").priority(0.5).build();

        assertTrue(state.shouldEngage(event));
    }

    @Test
    void shouldDoubleCadenceWhenComputeBudgetIsLow() {
        state.setComputeBudget(0.4);
        assertEquals(Duration.ofSeconds(6), state.getCadence());

        state.setComputeBudget(0.5);
        assertEquals(Duration.ofSeconds(3), state.getCadence());
    }

    @Test
    void shouldClampNaNInputs() {
        state.recordActivity(Duration.ofSeconds(1), Double.NaN);
        state.setComputeBudget(Double.NaN);

        PersonaStateSnapshot snapshot = state.getState();
        assertEquals(1.0, snapshot.getEnergy());
        assertEquals(0.0, snapshot.getComputeBudget());
    }
}
