package me.golemcore.scheduler.domain.loop;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.coordination.TurnCoordinator;
import me.golemcore.scheduler.domain.model.ActionResult;
import me.golemcore.scheduler.domain.model.InboxEntry;
import me.golemcore.scheduler.domain.model.LoopStatus;
import me.golemcore.scheduler.domain.model.PersonaRole;
import me.golemcore.scheduler.inbox.EventInbox;
import me.golemcore.scheduler.persona.PersonaStateManager;
import me.golemcore.scheduler.port.outbound.ActionExecutorPort;
import me.golemcore.scheduler.ratelimit.RateLimiter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Autonomous scheduling loop of one persona.
 *
 * <p>
 * Each iteration:
 * <ol>
 * <li>computes the cadence from the persona's state and rests for it,
 * crediting the time actually slept as recovery;</li>
 * <li>peeks the top inbox entries without removing them;</li>
 * <li>skips entries whose context is rate limited or whose priority is below
 * the engagement threshold;</li>
 * <li>asks the {@link TurnCoordinator} for a turn on the first remaining
 * candidate;</li>
 * <li>on grant, removes exactly that entry, dispatches it to the
 * {@link ActionExecutorPort} and records activity and rate usage;</li>
 * <li>refreshes the inbox load.</li>
 * </ol>
 *
 * <p>
 * A failed action never ends the loop. An unexpected fault backs off for a
 * multiple of the cadence and resumes. The loop ends only through
 * {@link #stop()} or an interrupt of its thread.
 *
 * @since 1.0
 */
@Slf4j
public class PersonaSchedulerLoop implements Runnable {

    private final String agentId;
    private final PersonaRole role;
    private final PersonaStateManager state;
    private final EventInbox inbox;
    private final RateLimiter rateLimiter;
    private final TurnCoordinator turnCoordinator;
    private final ActionExecutorPort actionExecutor;
    private final LoopSettings settings;
    private final Clock clock;

    private volatile boolean running = true;
    private volatile LoopStatus status = LoopStatus.CREATED;
    private volatile Thread worker;

    @Builder
    public PersonaSchedulerLoop(String agentId, PersonaRole role, PersonaStateManager state, EventInbox inbox,
            RateLimiter rateLimiter, TurnCoordinator turnCoordinator, ActionExecutorPort actionExecutor,
            LoopSettings settings, Clock clock) {
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.role = role != null ? role : PersonaRole.PARTICIPANT;
        this.state = Objects.requireNonNull(state, "state");
        this.inbox = Objects.requireNonNull(inbox, "inbox");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.turnCoordinator = Objects.requireNonNull(turnCoordinator, "turnCoordinator");
        this.actionExecutor = Objects.requireNonNull(actionExecutor, "actionExecutor");
        this.settings = settings != null ? settings : LoopSettings.defaults();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public void run() {
        worker = Thread.currentThread();
        status = LoopStatus.RUNNING;
        log.info("[PersonaLoop] {} started (role={})", agentId, role);
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                Duration cadence = state.getCadence();
                try {
                    rest(cadence);
                    if (!running) {
                        break;
                    }
                    runCycle();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException e) { // NOSONAR - a persona loop must outlive any single fault
                    Duration backoff = cadence.multipliedBy(settings.getFailureBackoffMultiplier());
                    log.error("[PersonaLoop] {} cycle failed, backing off {}ms: {}",
                            agentId, backoff.toMillis(), e.getMessage(), e);
                    if (!backOff(backoff)) {
                        break;
                    }
                }
            }
        } finally {
            status = LoopStatus.STOPPED;
            worker = null;
            log.info("[PersonaLoop] {} stopped", agentId);
        }
    }

    /**
     * Signal shutdown and wake the loop from any blocking wait.
     */
    public void stop() {
        running = false;
        Thread current = worker;
        if (current != null) {
            current.interrupt();
        }
    }

    /**
     * One evaluation pass over the inbox, without the preceding rest.
     */
    public CycleOutcome runCycle() {
        CycleOutcome outcome = CycleOutcome.NO_CANDIDATE;
        List<InboxEntry> candidates = inbox.peek(settings.getPeekCount());
        for (InboxEntry candidate : candidates) {
            if (rateLimiter.isRateLimited(candidate.contextId())) {
                log.debug("[PersonaLoop] {} rate limited in {}, skipping event {}",
                        agentId, candidate.contextId(), candidate.eventId());
                continue;
            }
            if (!state.shouldEngage(candidate.event())) {
                log.debug("[PersonaLoop] {} not engaging with event {} (priority={}, mood={})",
                        agentId, candidate.eventId(), candidate.priority(), state.getMood());
                continue;
            }
            outcome = engage(candidate);
            break;
        }
        state.updateInboxLoad(inbox.size());
        return outcome;
    }

    public String getAgentId() {
        return agentId;
    }

    public PersonaRole getRole() {
        return role;
    }

    public LoopStatus getStatus() {
        return status;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Pause the calling thread. Overridable for tests.
     */
    protected void sleep(Duration duration) throws InterruptedException {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    }

    private CycleOutcome engage(InboxEntry candidate) {
        boolean granted = turnCoordinator.requestTurn(agentId, candidate.eventId(), candidate.contextId(),
                candidate.priority(), role, settings.getTurnRequestTimeout());
        if (!granted) {
            if (turnCoordinator.getDecision(candidate.eventId()).isPresent()) {
                inbox.remove(candidate);
                log.debug("[PersonaLoop] {} denied turn on {}", agentId, candidate.eventId());
                return CycleOutcome.DENIED;
            }
            log.debug("[PersonaLoop] {} got no decision for {} in time, keeping it queued",
                    agentId, candidate.eventId());
            return CycleOutcome.TIMED_OUT;
        }

        if (!inbox.remove(candidate)) {
            log.debug("[PersonaLoop] {} granted event {} was evicted meanwhile, acting on it anyway",
                    agentId, candidate.eventId());
        }
        return dispatch(candidate);
    }

    private CycleOutcome dispatch(InboxEntry entry) {
        Instant start = clock.instant();
        ActionResult result = null;
        boolean success;
        try {
            result = actionExecutor.execute(agentId, entry.event());
            success = result != null && result.isSuccess();
            if (!success) {
                log.warn("[PersonaLoop] {} action on {} reported failure: {}", agentId, entry.eventId(),
                        result != null ? result.getMessage() : "no result");
            }
        } catch (RuntimeException e) {
            success = false;
            log.error("[PersonaLoop] {} action on {} failed: {}", agentId, entry.eventId(), e.getMessage(), e);
        }

        Instant finished = clock.instant();
        Duration measured = result != null && result.getDuration() != null
                ? result.getDuration()
                : Duration.between(start, finished);
        Duration accounted = measured.compareTo(settings.getMinimumActivityDuration()) < 0
                ? settings.getMinimumActivityDuration()
                : measured;
        double complexity = result != null && result.getComplexity() != null
                ? result.getComplexity()
                : entry.priority();

        state.recordActivity(accounted, complexity);
        rateLimiter.recordResponse(entry.contextId());
        // action time only; the gather wait must not feed back into the window
        turnCoordinator.recordResponseLatency(Duration.between(start, finished));

        if (success) {
            log.info("[PersonaLoop] {} acted on {} in {} ({}ms)", agentId, entry.eventId(), entry.contextId(),
                    measured.toMillis());
            return CycleOutcome.ACTED;
        }
        return CycleOutcome.ACTION_FAILED;
    }

    private void rest(Duration cadence) throws InterruptedException {
        Instant start = clock.instant();
        try {
            sleep(cadence);
        } finally {
            state.rest(Duration.between(start, clock.instant()));
        }
    }

    private boolean backOff(Duration backoff) {
        try {
            sleep(backoff);
            return running;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
