package me.golemcore.scheduler.domain.service;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.coordination.TurnCoordinator;
import me.golemcore.scheduler.domain.loop.LoopSettings;
import me.golemcore.scheduler.domain.loop.PersonaSchedulerLoop;
import me.golemcore.scheduler.domain.model.EnqueueOutcome;
import me.golemcore.scheduler.domain.model.InboxEvent;
import me.golemcore.scheduler.domain.model.LoopStatus;
import me.golemcore.scheduler.domain.model.PersonaInspection;
import me.golemcore.scheduler.domain.model.PersonaRole;
import me.golemcore.scheduler.inbox.EventInbox;
import me.golemcore.scheduler.inbox.PriorityEventInbox;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.persona.CadenceTable;
import me.golemcore.scheduler.persona.PersonaStateManager;
import me.golemcore.scheduler.port.outbound.ActionExecutorPort;
import me.golemcore.scheduler.ratelimit.ContextRateLimiter;
import me.golemcore.scheduler.ratelimit.RateLimitPolicy;
import me.golemcore.scheduler.ratelimit.RateLimiter;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hosts the persona pool.
 *
 * <p>
 * Each registered persona owns its inbox, state model and rate limiter, and
 * runs its {@link PersonaSchedulerLoop} on a dedicated thread. All personas
 * share one {@link TurnCoordinator}. Personas listed under
 * {@code scheduler.personas} are registered at startup; loops are only
 * started when {@code scheduler.enabled} is true.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class PersonaRuntimeService {

    private final SchedulerProperties properties;
    private final CadenceTable cadenceTable;
    private final RateLimitPolicy rateLimitPolicy;
    private final LoopSettings loopSettings;
    private final TurnCoordinator turnCoordinator;
    private final ActionExecutorPort actionExecutor;
    private final Clock clock;

    private final Map<String, Persona> personas = new ConcurrentHashMap<>();
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService loopExecutor;

    private volatile boolean loopsEnabled;

    public PersonaRuntimeService(SchedulerProperties properties, CadenceTable cadenceTable,
            RateLimitPolicy rateLimitPolicy, LoopSettings loopSettings, TurnCoordinator turnCoordinator,
            ActionExecutorPort actionExecutor, Clock clock) {
        this.properties = properties;
        this.cadenceTable = cadenceTable;
        this.rateLimitPolicy = rateLimitPolicy;
        this.loopSettings = loopSettings;
        this.turnCoordinator = turnCoordinator;
        this.actionExecutor = actionExecutor;
        this.clock = clock;
        this.loopExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "persona-loop-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        loopsEnabled = properties.isEnabled();
        for (SchedulerProperties.PersonaProperties persona : properties.getPersonas()) {
            register(resolve(persona));
        }
        if (loopsEnabled) {
            log.info("[PersonaRuntime] Started {} persona loop(s)", personas.size());
        } else {
            log.info("[PersonaRuntime] Scheduler disabled, {} persona(s) registered without loops",
                    personas.size());
        }
    }

    @PreDestroy
    public void shutdown() {
        loopsEnabled = false;
        for (Persona persona : personas.values()) {
            persona.loop().stop();
            persona.inbox().close();
        }
        loopExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                loopExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            loopExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[PersonaRuntime] Shut down");
    }

    /**
     * Register a persona with the scheduler-wide inbox, rate limit and
     * cadence settings.
     */
    public PersonaInspection register(String agentId, PersonaRole role, double computeBudget) {
        return register(PersonaDefinition.builder()
                .agentId(agentId)
                .role(role != null ? role : PersonaRole.PARTICIPANT)
                .computeBudget(computeBudget)
                .inboxCapacity(properties.getInbox().getCapacity())
                .rateLimitPolicy(rateLimitPolicy)
                .cadenceTable(cadenceTable)
                .build());
    }

    /**
     * Register a persona and start its loop when the scheduler is enabled.
     *
     * @throws IllegalArgumentException
     *             if the id is blank or the inbox capacity is not positive
     * @throws IllegalStateException
     *             if a persona with this id already exists
     */
    public PersonaInspection register(PersonaDefinition definition) {
        String agentId = definition.getAgentId();
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("Persona id must not be blank");
        }
        PersonaRole effectiveRole = definition.getRole() != null ? definition.getRole() : PersonaRole.PARTICIPANT;

        PersonaStateManager state = new PersonaStateManager(agentId, definition.getCadenceTable(), clock);
        state.setComputeBudget(definition.getComputeBudget());
        EventInbox inbox = new PriorityEventInbox(agentId, definition.getInboxCapacity(), clock);
        RateLimiter rateLimiter = new ContextRateLimiter(agentId, definition.getRateLimitPolicy(), clock);
        PersonaSchedulerLoop loop = PersonaSchedulerLoop.builder()
                .agentId(agentId)
                .role(effectiveRole)
                .state(state)
                .inbox(inbox)
                .rateLimiter(rateLimiter)
                .turnCoordinator(turnCoordinator)
                .actionExecutor(actionExecutor)
                .settings(loopSettings)
                .clock(clock)
                .build();
        Persona persona = new Persona(agentId, effectiveRole, definition, state, inbox, rateLimiter, loop);

        if (personas.putIfAbsent(agentId, persona) != null) {
            throw new IllegalStateException("Persona already registered: " + agentId);
        }
        log.info("[PersonaRuntime] Registered {} (role={}, computeBudget={}, inboxCapacity={}, rateLimit={})",
                agentId, effectiveRole, definition.getComputeBudget(), definition.getInboxCapacity(),
                definition.getRateLimitPolicy());
        if (loopsEnabled) {
            loopExecutor.execute(loop);
        }
        return inspect(persona);
    }

    /**
     * Queue an event for one persona with the priority it already carries.
     */
    public EnqueueOutcome deliver(String agentId, InboxEvent event) {
        return require(agentId).inbox().enqueue(event);
    }

    /**
     * Queue the same event for several personas, each with its own priority.
     * With an empty priority map every registered persona receives the event
     * at its original priority.
     */
    public Map<String, EnqueueOutcome> broadcast(InboxEvent event, Map<String, Double> priorities) {
        Map<String, EnqueueOutcome> outcomes = new LinkedHashMap<>();
        if (priorities == null || priorities.isEmpty()) {
            for (String agentId : getPersonaIds()) {
                outcomes.put(agentId, deliver(agentId, event));
            }
            return outcomes;
        }
        for (Map.Entry<String, Double> target : priorities.entrySet()) {
            Persona persona = require(target.getKey());
            double priority = target.getValue() != null ? target.getValue() : event.getPriority();
            outcomes.put(target.getKey(), persona.inbox().enqueue(event.withPriority(priority)));
        }
        return outcomes;
    }

    public void setComputeBudget(String agentId, double computeBudget) {
        require(agentId).state().setComputeBudget(computeBudget);
        log.info("[PersonaRuntime] {} compute budget set to {}", agentId, computeBudget);
    }

    /**
     * Start a fresh rate-limit session in a context for every persona, e.g.
     * when the room is left.
     */
    public void resetContext(String contextId) {
        for (Persona persona : personas.values()) {
            persona.rateLimiter().reset(contextId);
        }
        log.debug("[PersonaRuntime] Rate limits reset for context {}", contextId);
    }

    /**
     * Stop one persona's loop and close its inbox. The persona stays
     * inspectable.
     */
    public void stop(String agentId) {
        Persona persona = require(agentId);
        persona.loop().stop();
        persona.inbox().close();
        log.info("[PersonaRuntime] Stopped {}", agentId);
    }

    public List<String> getPersonaIds() {
        return personas.keySet().stream().sorted().toList();
    }

    public Optional<PersonaInspection> inspect(String agentId) {
        return Optional.ofNullable(personas.get(agentId)).map(this::inspect);
    }

    public List<PersonaInspection> inspectAll() {
        return personas.values().stream()
                .sorted(Comparator.comparing(Persona::agentId))
                .map(this::inspect)
                .toList();
    }

    private PersonaInspection inspect(Persona persona) {
        LoopStatus status = persona.loop().getStatus();
        return PersonaInspection.builder()
                .agentId(persona.agentId())
                .role(persona.role())
                .status(status)
                .state(persona.state().getState())
                .cadence(persona.state().getCadence())
                .inboxDepth(persona.inbox().size())
                .inboxCapacity(persona.inbox().getCapacity())
                .minResponseInterval(persona.definition().getRateLimitPolicy().getMinIntervalBetweenResponses())
                .maxResponsesPerSession(persona.definition().getRateLimitPolicy().getMaxResponsesPerSession())
                .droppedEvents(persona.inbox().getDroppedCount())
                .rateLimits(persona.rateLimiter().getAllRateLimitInfo())
                .build();
    }

    private PersonaDefinition resolve(SchedulerProperties.PersonaProperties persona) {
        int inboxCapacity = persona.getInboxCapacity() != null
                ? persona.getInboxCapacity()
                : properties.getInbox().getCapacity();

        RateLimitPolicy effectiveRateLimit = rateLimitPolicy;
        SchedulerProperties.RateLimitOverrides rateLimit = persona.getRateLimit();
        if (rateLimit != null && (rateLimit.getMinSecondsBetweenResponses() != null
                || rateLimit.getMaxResponsesPerSession() != null)) {
            effectiveRateLimit = new RateLimitPolicy(
                    rateLimit.getMinSecondsBetweenResponses() != null
                            ? Duration.ofSeconds(rateLimit.getMinSecondsBetweenResponses())
                            : rateLimitPolicy.getMinIntervalBetweenResponses(),
                    rateLimit.getMaxResponsesPerSession() != null
                            ? rateLimit.getMaxResponsesPerSession()
                            : rateLimitPolicy.getMaxResponsesPerSession());
        }

        CadenceTable effectiveCadence = cadenceTable;
        SchedulerProperties.CadenceOverrides cadence = persona.getCadence();
        if (cadence != null) {
            effectiveCadence = cadenceTable.toBuilder()
                    .overwhelmed(orDefault(cadence.getOverwhelmed(), cadenceTable.getOverwhelmed()))
                    .tired(orDefault(cadence.getTired(), cadenceTable.getTired()))
                    .active(orDefault(cadence.getActive(), cadenceTable.getActive()))
                    .idle(orDefault(cadence.getIdle(), cadenceTable.getIdle()))
                    .build();
        }

        return PersonaDefinition.builder()
                .agentId(persona.getId())
                .role(persona.getRole() != null ? persona.getRole() : PersonaRole.PARTICIPANT)
                .computeBudget(persona.getComputeBudget())
                .inboxCapacity(inboxCapacity)
                .rateLimitPolicy(effectiveRateLimit)
                .cadenceTable(effectiveCadence)
                .build();
    }

    private static Duration orDefault(Duration override, Duration fallback) {
        return override != null ? override : fallback;
    }

    private Persona require(String agentId) {
        Persona persona = personas.get(agentId);
        if (persona == null) {
            throw new IllegalArgumentException("Unknown persona: " + agentId);
        }
        return persona;
    }

    private record Persona(String agentId, PersonaRole role, PersonaDefinition definition,
            PersonaStateManager state, EventInbox inbox, RateLimiter rateLimiter, PersonaSchedulerLoop loop) {
    }
}
