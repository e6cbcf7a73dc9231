package me.golemcore.scheduler.domain.loop;

import me.golemcore.scheduler.coordination.CoordinationPolicy;
import me.golemcore.scheduler.coordination.TurnCoordinator;
import me.golemcore.scheduler.domain.model.ActionResult;
import me.golemcore.scheduler.domain.model.InboxEvent;
import me.golemcore.scheduler.domain.model.LoopStatus;
import me.golemcore.scheduler.domain.model.PersonaRole;
import me.golemcore.scheduler.domain.model.TurnDecision;
import me.golemcore.scheduler.inbox.PriorityEventInbox;
import me.golemcore.scheduler.infrastructure.event.SpringEventBus;
import me.golemcore.scheduler.persona.CadenceTable;
import me.golemcore.scheduler.persona.PersonaStateManager;
import me.golemcore.scheduler.port.outbound.ActionExecutionException;
import me.golemcore.scheduler.port.outbound.ActionExecutorPort;
import me.golemcore.scheduler.ratelimit.ContextRateLimiter;
import me.golemcore.scheduler.ratelimit.RateLimitPolicy;
import me.golemcore.scheduler.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import static org.junit.jupiter.api.Assertions.*;

class PersonaSchedulerLoopTest {

    private static final String AGENT = "helper";
    private static final String ROOM = "room-1";
    private static final String OTHER_ROOM = "room-2";

    private MutableClock clock;
    private PersonaStateManager state;
    private PriorityEventInbox inbox;
    private ContextRateLimiter rateLimiter;
    private TurnCoordinator turnCoordinator;
    private ActionExecutorPort actionExecutor;
    private PersonaSchedulerLoop loop;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        state = new PersonaStateManager(AGENT, CadenceTable.defaults(), clock);
        inbox = new PriorityEventInbox(AGENT, 100, clock);
        rateLimiter = new ContextRateLimiter(AGENT, RateLimitPolicy.defaults(), clock);
        turnCoordinator = mock(TurnCoordinator.class);
        actionExecutor = mock(ActionExecutorPort.class);
        loop = PersonaSchedulerLoop.builder()
                .agentId(AGENT)
                .role(PersonaRole.PARTICIPANT)
                .state(state)
                .inbox(inbox)
                .rateLimiter(rateLimiter)
                .turnCoordinator(turnCoordinator)
                .actionExecutor(actionExecutor)
                .settings(LoopSettings.defaults())
                .clock(clock)
                .build();
    }

    @Test
    void shouldActOnGrantedEventAndRecordOutcome() {
        inbox.enqueue(event("e1", ROOM, 0.5));
        grantTurns(true);
        when(actionExecutor.execute(eq(AGENT), any(InboxEvent.class)))
                .thenReturn(ActionResult.success(Duration.ofSeconds(1)));

        CycleOutcome outcome = loop.runCycle();

        assertEquals(CycleOutcome.ACTED, outcome);
        assertEquals(0, inbox.size());
        assertEquals(1, rateLimiter.getResponseCount(ROOM));
        assertEquals(1, state.getState().getResponseCount());
        // minimum activity duration of 3s at priority 0.5
        assertEquals(0.85, state.getState().getEnergy(), 1e-9);
        verify(turnCoordinator).requestTurn(eq(AGENT), eq("e1"), eq(ROOM), eq(0.5), eq(PersonaRole.PARTICIPANT),
                eq(Duration.ofSeconds(25)));
        verify(turnCoordinator).recordResponseLatency(any(Duration.class));
    }

    @Test
    void shouldReportOnlyActionTimeAsResponseLatency() {
        inbox.enqueue(event("e1", ROOM, 0.5));
        when(turnCoordinator.requestTurn(anyString(), anyString(), anyString(), anyDouble(), any(), any()))
                .thenAnswer(invocation -> {
                    clock.advance(Duration.ofSeconds(2));
                    return true;
                });
        when(actionExecutor.execute(eq(AGENT), any(InboxEvent.class))).thenAnswer(invocation -> {
            clock.advance(Duration.ofMillis(100));
            return ActionResult.success(null);
        });

        loop.runCycle();

        verify(turnCoordinator).recordResponseLatency(Duration.ofMillis(100));
    }

    @Test
    void shouldKeepGatherWindowStableUnderConstantActionLatency() throws Exception {
        TurnCoordinator coordinator = new TurnCoordinator(CoordinationPolicy.builder()
                .minGatherWindow(Duration.ofMillis(50))
                .maxGatherWindow(Duration.ofMillis(800))
                .initialLatency(Duration.ofMillis(100))
                .build(), Clock.systemUTC(), mock(SpringEventBus.class));
        coordinator.start();
        when(actionExecutor.execute(eq(AGENT), any(InboxEvent.class))).thenAnswer(invocation -> {
            Thread.sleep(100);
            return ActionResult.success(null);
        });
        PersonaSchedulerLoop live = PersonaSchedulerLoop.builder()
                .agentId(AGENT)
                .role(PersonaRole.PARTICIPANT)
                .state(state)
                .inbox(inbox)
                .rateLimiter(rateLimiter)
                .turnCoordinator(coordinator)
                .actionExecutor(actionExecutor)
                .settings(LoopSettings.defaults())
                .clock(Clock.systemUTC())
                .build();
        try {
            for (int i = 0; i < 10; i++) {
                inbox.enqueue(event("e" + i, "room-" + i, 0.9));
                assertEquals(CycleOutcome.ACTED, live.runCycle());
            }

            assertTrue(coordinator.getCurrentGatherWindow().compareTo(Duration.ofMillis(250)) < 0,
                    "window grew to " + coordinator.getCurrentGatherWindow());
        } finally {
            coordinator.shutdown();
        }
    }

    @Test
    void shouldRemoveTheArbitratedEntryEvenIfAHigherOneArrived() {
        inbox.enqueue(event("e1", ROOM, 0.5));
        when(turnCoordinator.requestTurn(anyString(), anyString(), anyString(), anyDouble(), any(), any()))
                .thenAnswer(invocation -> {
                    inbox.enqueue(event("e2", ROOM, 0.95));
                    return true;
                });
        when(actionExecutor.execute(eq(AGENT), any(InboxEvent.class)))
                .thenReturn(ActionResult.success(Duration.ofSeconds(1)));

        loop.runCycle();

        assertEquals(List.of("e2"), inbox.peek(5).stream().map(entry -> entry.eventId()).toList());
        verify(actionExecutor).execute(eq(AGENT), eq(event("e1", ROOM, 0.5)));
    }

    @Test
    void shouldSkipRateLimitedContextBeforeRequestingTurn() {
        rateLimiter.recordResponse(ROOM);
        inbox.enqueue(event("e1", ROOM, 0.6));
        inbox.enqueue(event("e2", OTHER_ROOM, 0.4));
        grantTurns(true);
        when(actionExecutor.execute(eq(AGENT), any(InboxEvent.class)))
                .thenReturn(ActionResult.success(Duration.ofSeconds(1)));

        loop.runCycle();

        verify(turnCoordinator, never()).requestTurn(anyString(), eq("e1"), anyString(), anyDouble(), any(), any());
        verify(turnCoordinator).requestTurn(anyString(), eq("e2"), anyString(), anyDouble(), any(), any());
        assertEquals(1, inbox.size());
    }

    @Test
    void shouldNotRequestTurnBelowEngagementThreshold() {
        inbox.enqueue(event("e1", ROOM, 0.05));
        inbox.enqueue(event("e2", ROOM, 0.08));

        CycleOutcome outcome = loop.runCycle();

        assertEquals(CycleOutcome.NO_CANDIDATE, outcome);
        verifyNoInteractions(turnCoordinator, actionExecutor);
        assertEquals(2, state.getState().getInboxLoad());
    }

    @Test
    void shouldDropEntryWhenTurnDenied() {
        inbox.enqueue(event("e1", ROOM, 0.5));
        grantTurns(false);
        when(turnCoordinator.getDecision("e1")).thenReturn(Optional.of(TurnDecision.builder()
                .triggerId("e1")
                .granted(List.of("other"))
                .denied(List.of(AGENT))
                .build()));

        CycleOutcome outcome = loop.runCycle();

        assertEquals(CycleOutcome.DENIED, outcome);
        assertEquals(0, inbox.size());
        verifyNoInteractions(actionExecutor);
        assertEquals(0, rateLimiter.getResponseCount(ROOM));
    }

    @Test
    void shouldKeepEntryWhenNoDecisionArrivedInTime() {
        inbox.enqueue(event("e1", ROOM, 0.5));
        grantTurns(false);
        when(turnCoordinator.getDecision("e1")).thenReturn(Optional.empty());

        CycleOutcome outcome = loop.runCycle();

        assertEquals(CycleOutcome.TIMED_OUT, outcome);
        assertEquals(1, inbox.size());
    }

    @Test
    void shouldStillAccountForFailedAction() {
        inbox.enqueue(event("e1", ROOM, 0.5));
        grantTurns(true);
        when(actionExecutor.execute(eq(AGENT), any(InboxEvent.class)))
                .thenThrow(new ActionExecutionException("provider unavailable"));

        CycleOutcome outcome = loop.runCycle();

        assertEquals(CycleOutcome.ACTION_FAILED, outcome);
        assertEquals(0, inbox.size());
        assertEquals(1, state.getState().getResponseCount());
        assertTrue(rateLimiter.isRateLimited(ROOM));
    }

    @Test
    void shouldTreatUnsuccessfulResultAsFailure() {
        inbox.enqueue(event("e1", ROOM, 0.5));
        grantTurns(true);
        when(actionExecutor.execute(eq(AGENT), any(InboxEvent.class)))
                .thenReturn(ActionResult.failure("rejected by room", Duration.ofSeconds(2)));

        assertEquals(CycleOutcome.ACTION_FAILED, loop.runCycle());
        assertEquals(1, state.getState().getResponseCount());
    }

    @Test
    void shouldUseReportedComplexityForFatigue() {
        inbox.enqueue(event("e1", ROOM, 0.5));
        grantTurns(true);
        ActionResult heavy = ActionResult.success(Duration.ofSeconds(5));
        heavy.setComplexity(1.0);
        when(actionExecutor.execute(eq(AGENT), any(InboxEvent.class))).thenReturn(heavy);

        loop.runCycle();

        assertEquals(0.5, state.getState().getEnergy(), 1e-9);
    }

    @Test
    void shouldBackOffAfterUnexpectedFaultAndKeepRunning() {
        inbox.enqueue(event("e1", ROOM, 0.5));
        when(turnCoordinator.requestTurn(anyString(), anyString(), anyString(), anyDouble(), any(), any()))
                .thenThrow(new IllegalStateException("coordinator glitch"));
        List<Duration> sleeps = new ArrayList<>();
        PersonaSchedulerLoop recording = new PersonaSchedulerLoop(AGENT, PersonaRole.PARTICIPANT, state, inbox,
                rateLimiter, turnCoordinator, actionExecutor, LoopSettings.defaults(), clock) {
            @Override
            protected void sleep(Duration duration) {
                sleeps.add(duration);
                if (sleeps.size() == 4) {
                    stop();
                }
            }
        };

        recording.run();
        Thread.interrupted();

        assertEquals(List.of(Duration.ofSeconds(3), Duration.ofSeconds(6), Duration.ofSeconds(3),
                Duration.ofSeconds(6)), sleeps);
        assertEquals(LoopStatus.STOPPED, recording.getStatus());
        assertFalse(recording.isRunning());
        assertEquals(1, inbox.size());
    }

    @Test
    void shouldStopWhenInterrupted() {
        PersonaSchedulerLoop interrupted = new PersonaSchedulerLoop(AGENT, PersonaRole.PARTICIPANT, state, inbox,
                rateLimiter, turnCoordinator, actionExecutor, LoopSettings.defaults(), clock) {
            @Override
            protected void sleep(Duration duration) throws InterruptedException {
                throw new InterruptedException("shutdown");
            }
        };
        assertEquals(LoopStatus.CREATED, interrupted.getStatus());

        interrupted.run();

        assertTrue(Thread.interrupted());
        assertEquals(LoopStatus.STOPPED, interrupted.getStatus());
        verifyNoInteractions(turnCoordinator);
    }

    private void grantTurns(boolean granted) {
        when(turnCoordinator.requestTurn(anyString(), anyString(), anyString(), anyDouble(), any(), any()))
                .thenReturn(granted);
    }

    private static InboxEvent event(String id, String contextId, double priority) {
        return InboxEvent.builder()
                .id(id)
                .contextId(contextId)
                .payload("hello")
                .priority(priority)
                .build();
    }
}
