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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.CoordinationPhase;
import me.golemcore.scheduler.domain.model.CoordinationStats;
import me.golemcore.scheduler.domain.model.PersonaRole;
import me.golemcore.scheduler.domain.model.RejectionReason;
import me.golemcore.scheduler.domain.model.TurnDecidedEvent;
import me.golemcore.scheduler.domain.model.TurnDecision;
import me.golemcore.scheduler.domain.model.TurnIntent;
import me.golemcore.scheduler.domain.model.TurnRejection;
import me.golemcore.scheduler.infrastructure.event.SpringEventBus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cross-persona arbitration of who may act on a trigger.
 *
 * <p>
 * Each trigger moves through {@code GATHERING -> DECIDING -> DECIDED}:
 * <ul>
 * <li>The first intent creates the context and starts a gather timer whose
 * length follows the smoothed response latency ({@link AdaptiveGatherWindow}).</li>
 * <li>Further intents are appended without blocking the caller.</li>
 * <li>Gathering closes when the window expires, or early once a very confident
 * intent and at least one other are present, or when every intent has been
 * withdrawn.</li>
 * <li>The decision ({@link TurnArbiter}) is cached and immutable. Late callers
 * receive it as is; nothing is re-negotiated.</li>
 * </ul>
 *
 * <p>
 * Mutation of a trigger's context is serialized on that context's monitor;
 * distinct triggers proceed in parallel. Decided contexts are dropped after
 * the retention window.
 *
 * @since 1.0
 * @see TurnArbiter
 */
@Slf4j
public class TurnCoordinator {

    private static final double SINGLE_RESPONDER_CHANCE = 0.70;
    private static final double DOUBLE_RESPONDER_CHANCE = 0.95;

    private final CoordinationPolicy policy;
    private final Clock clock;
    private final SpringEventBus eventBus;
    private final Random random;
    private final AdaptiveGatherWindow gatherWindow;
    private final RecentResponders recentResponders;
    private final TurnArbiter arbiter;
    private final ScheduledExecutorService timer;

    private final Map<String, CoordinationContext> contexts = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong totalDecisions = new AtomicLong();

    private ScheduledFuture<?> cleanupTask;

    public TurnCoordinator(CoordinationPolicy policy, Clock clock, SpringEventBus eventBus) {
        this(policy, clock, eventBus, new Random());
    }

    public TurnCoordinator(CoordinationPolicy policy, Clock clock, SpringEventBus eventBus, Random random) {
        if (policy.getMaxResponders() < 1) {
            throw new IllegalArgumentException("maxResponders must be at least 1");
        }
        this.policy = policy;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.random = Objects.requireNonNull(random, "random");
        this.gatherWindow = new AdaptiveGatherWindow(policy);
        this.recentResponders = new RecentResponders(policy.getRecentResponderHistory());
        this.arbiter = new TurnArbiter(policy);
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "turn-coordinator");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        long intervalMs = policy.getCleanupInterval().toMillis();
        cleanupTask = timer.scheduleAtFixedRate(this::cleanup, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[TurnCoordinator] Started (maxResponders={}, gather window {}..{}, retention={})",
                policy.getMaxResponders(), policy.getMinGatherWindow(), policy.getMaxGatherWindow(),
                policy.getRetention());
    }

    /**
     * Decide every open context so no caller stays blocked, then stop the
     * timer thread.
     */
    public void shutdown() {
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
        }
        for (CoordinationContext context : contexts.values()) {
            closeGathering(context, "shutdown");
        }
        timer.shutdown();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                timer.shutdownNow();
            }
        } catch (InterruptedException e) {
            timer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[TurnCoordinator] Shut down");
    }

    /**
     * Register an intent in the trigger's own context without waiting.
     */
    public void registerIntent(String triggerId, String agentId, double confidence) {
        register(triggerId, triggerId, agentId, confidence, PersonaRole.PARTICIPANT);
    }

    public void registerIntent(String triggerId, String contextId, String agentId, double confidence,
            PersonaRole role) {
        register(triggerId, contextId, agentId, confidence, role);
    }

    public boolean requestTurn(String agentId, String triggerId, double confidence, Duration timeout) {
        return requestTurn(agentId, triggerId, triggerId, confidence, PersonaRole.PARTICIPANT, timeout);
    }

    /**
     * Register an intent and wait up to {@code timeout} for the decision.
     *
     * <p>
     * A timeout or interrupt counts as "not granted"; the intent is withdrawn
     * so it does not occupy a slot nobody will use.
     *
     * @return whether this persona may act on the trigger
     */
    public boolean requestTurn(String agentId, String triggerId, String contextId, double confidence,
            PersonaRole role, Duration timeout) {
        CoordinationContext context = register(triggerId, contextId, agentId, confidence, role);
        try {
            TurnDecision decision = context.decisionFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return decision.isGranted(agentId);
        } catch (TimeoutException e) {
            log.debug("[TurnCoordinator] {} timed out after {}ms waiting for {}", agentId, timeout.toMillis(),
                    triggerId);
            return resolveAfterAbandon(context, triggerId, agentId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return resolveAfterAbandon(context, triggerId, agentId);
        } catch (ExecutionException e) {
            log.warn("[TurnCoordinator] Decision for {} failed: {}", triggerId, e.getMessage());
            return false;
        }
    }

    /**
     * Remove an intent while the trigger is still gathering.
     *
     * @return true if the intent was withdrawn
     */
    public boolean withdrawIntent(String triggerId, String agentId) {
        CoordinationContext context = contexts.get(triggerId);
        if (context == null) {
            return false;
        }
        TurnDecision decided = null;
        boolean withdrawn;
        synchronized (context) {
            if (!context.isGathering()) {
                return false;
            }
            withdrawn = context.withdraw(agentId);
            if (withdrawn && context.intentCount() == 0) {
                decided = decideLocked(context, "all intents withdrawn");
            }
        }
        if (withdrawn) {
            log.debug("[TurnCoordinator] {} withdrew from {}", agentId, triggerId);
        }
        publish(decided);
        return withdrawn;
    }

    /**
     * Feed an observed grant-to-completion latency into the gather window.
     */
    public void recordResponseLatency(Duration latency) {
        gatherWindow.recordLatency(latency);
        log.debug("[TurnCoordinator] Response latency {}ms, gather window now {}ms",
                latency.toMillis(), gatherWindow.currentWindow().toMillis());
    }

    public Duration getCurrentGatherWindow() {
        return gatherWindow.currentWindow();
    }

    public Optional<TurnDecision> getDecision(String triggerId) {
        CoordinationContext context = contexts.get(triggerId);
        return context != null ? Optional.ofNullable(context.decisionOrNull()) : Optional.empty();
    }

    public Optional<CoordinationPhase> getPhase(String triggerId) {
        CoordinationContext context = contexts.get(triggerId);
        if (context == null) {
            return Optional.empty();
        }
        synchronized (context) {
            return Optional.of(context.phase());
        }
    }

    public List<TurnRejection> getRejections(String triggerId) {
        return getDecision(triggerId).map(TurnDecision::getRejections).orElse(List.of());
    }

    public List<String> getRecentResponders(String contextId) {
        return recentResponders.get(contextId);
    }

    public CoordinationStats getCoordinationStats() {
        int gathering = 0;
        int decided = 0;
        long rejections = 0;
        long intentsInDecisions = 0;
        Map<RejectionReason, Long> byReason = new EnumMap<>(RejectionReason.class);
        Map<PersonaRole, Long> byRole = new EnumMap<>(PersonaRole.class);

        for (CoordinationContext context : contexts.values()) {
            TurnDecision decision = context.decisionOrNull();
            if (decision == null) {
                gathering++;
                continue;
            }
            decided++;
            intentsInDecisions += decision.getIntents().size();
            for (TurnRejection rejection : decision.getRejections()) {
                rejections++;
                byReason.merge(rejection.reason(), 1L, Long::sum);
                if (rejection.role() != null) {
                    byRole.merge(rejection.role(), 1L, Long::sum);
                }
            }
        }

        return CoordinationStats.builder()
                .activeContexts(gathering + decided)
                .gatheringContexts(gathering)
                .decidedContexts(decided)
                .totalDecisions(totalDecisions.get())
                .totalRejections(rejections)
                .rejectionsByReason(byReason)
                .rejectionsByRole(byRole)
                .averageIntentsPerDecision(decided > 0 ? (double) intentsInDecisions / decided : 0.0)
                .currentGatherWindow(gatherWindow.currentWindow())
                .build();
    }

    /**
     * Drop decided contexts older than the retention window.
     */
    void cleanup() {
        try {
            Instant cutoff = clock.instant().minus(policy.getRetention());
            int removed = 0;
            for (Map.Entry<String, CoordinationContext> entry : contexts.entrySet()) {
                TurnDecision decision = entry.getValue().decisionOrNull();
                if (decision != null && decision.getDecidedAt().isBefore(cutoff)
                        && contexts.remove(entry.getKey(), entry.getValue())) {
                    removed++;
                }
            }
            if (removed > 0) {
                log.debug("[TurnCoordinator] Cleanup removed {} contexts, {} active", removed, contexts.size());
            }
        } catch (RuntimeException e) {
            log.error("[TurnCoordinator] Cleanup failed: {}", e.getMessage(), e);
        }
    }

    private CoordinationContext register(String triggerId, String contextId, String agentId, double confidence,
            PersonaRole role) {
        Objects.requireNonNull(triggerId, "triggerId");
        Objects.requireNonNull(agentId, "agentId");
        if (Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence is NaN for " + agentId);
        }
        double normalized = Math.max(0.0, Math.min(1.0, confidence));
        PersonaRole effectiveRole = role != null ? role : PersonaRole.PARTICIPANT;
        Instant now = clock.instant();

        CoordinationContext context = contexts.computeIfAbsent(triggerId,
                id -> new CoordinationContext(id, contextId != null ? contextId : id, now,
                        gatherWindow.currentWindow(), resolveSlots()));

        TurnDecision decided = null;
        synchronized (context) {
            if (!context.isGathering()) {
                log.debug("[TurnCoordinator] {} arrived after decision for {}", agentId, triggerId);
                return context;
            }
            context.addIntent(agentId, normalized, effectiveRole, now, sequence.incrementAndGet());
            log.debug("[TurnCoordinator] Intent: {} -> {} (conf={}, role={})",
                    agentId, triggerId, normalized, effectiveRole);

            if (!context.hasTimer()) {
                decided = scheduleGatherTimer(context);
            }
            if (decided == null && shouldDecideEarly(context)) {
                decided = decideLocked(context, "early consensus");
            }
        }
        publish(decided);
        return context;
    }

    private TurnDecision scheduleGatherTimer(CoordinationContext context) {
        try {
            context.setGatherTimer(timer.schedule(() -> closeGathering(context, "gather window expired"),
                    context.gatherWindow().toMillis(), TimeUnit.MILLISECONDS));
            return null;
        } catch (RejectedExecutionException e) {
            return decideLocked(context, "coordinator stopped");
        }
    }

    private void closeGathering(CoordinationContext context, String reason) {
        TurnDecision decided = null;
        synchronized (context) {
            if (context.isGathering()) {
                decided = decideLocked(context, reason);
            }
        }
        publish(decided);
    }

    private boolean shouldDecideEarly(CoordinationContext context) {
        if (context.intentCount() < 2) {
            return false;
        }
        return context.intentsSnapshot().stream()
                .mapToDouble(TurnIntent::confidence)
                .anyMatch(c -> c >= policy.getEarlyDecisionConfidence());
    }

    private TurnDecision decideLocked(CoordinationContext context, String reason) {
        context.markDeciding();
        TurnDecision decision = arbiter.decide(new TurnArbiter.ArbitrationRequest(
                context.triggerId(),
                context.contextId(),
                context.intentsSnapshot(),
                context.withdrawnSnapshot(),
                context.slots(),
                recentResponders.get(context.contextId()),
                context.startedAt(),
                clock.instant()));
        context.complete(decision);
        for (String agentId : decision.getGranted()) {
            recentResponders.record(context.contextId(), agentId);
        }
        totalDecisions.incrementAndGet();
        log.info("[TurnCoordinator] Decision for {} ({}): {} granted, {} denied - {}",
                context.triggerId(), reason, decision.getGranted().size(), decision.getDenied().size(),
                decision.getReasoning());
        return decision;
    }

    private boolean resolveAfterAbandon(CoordinationContext context, String triggerId, String agentId) {
        withdrawIntent(triggerId, agentId);
        TurnDecision decision = context.decisionOrNull();
        return decision != null && decision.isGranted(agentId);
    }

    private int resolveSlots() {
        if (!policy.isProbabilisticFanOut()) {
            return policy.getMaxResponders();
        }
        double draw = random.nextDouble();
        int slots;
        if (draw < SINGLE_RESPONDER_CHANCE) {
            slots = 1;
        } else if (draw < DOUBLE_RESPONDER_CHANCE) {
            slots = 2;
        } else {
            slots = 3;
        }
        return Math.min(slots, policy.getMaxResponders());
    }

    private void publish(TurnDecision decision) {
        if (decision == null) {
            return;
        }
        try {
            eventBus.publish(new TurnDecidedEvent(decision));
        } catch (RuntimeException e) {
            log.warn("[TurnCoordinator] Decision listener failed for {}: {}", decision.getTriggerId(),
                    e.getMessage());
        }
    }
}
