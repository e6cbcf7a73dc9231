package me.golemcore.scheduler.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.adapter.outbound.action.LoggingActionExecutorAdapter;
import me.golemcore.scheduler.coordination.CoordinationPolicy;
import me.golemcore.scheduler.coordination.TurnCoordinator;
import me.golemcore.scheduler.domain.loop.LoopSettings;
import me.golemcore.scheduler.infrastructure.event.SpringEventBus;
import me.golemcore.scheduler.persona.CadenceTable;
import me.golemcore.scheduler.port.outbound.ActionExecutorPort;
import me.golemcore.scheduler.ratelimit.RateLimitPolicy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the scheduler's immutable policies and shared components from
 * {@link SchedulerProperties}.
 *
 * <p>
 * The {@link TurnCoordinator} is a single shared instance; every persona loop
 * arbitrates through it. Hosts replace the logging action executor by
 * declaring their own {@link ActionExecutorPort} bean.
 *
 * @since 1.0
 */
@Configuration
@Slf4j
public class AutoConfiguration {

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public CadenceTable cadenceTable(SchedulerProperties properties) {
        SchedulerProperties.CadenceProperties cadence = properties.getCadence();
        return CadenceTable.builder()
                .overwhelmed(cadence.getOverwhelmed())
                .tired(cadence.getTired())
                .active(cadence.getActive())
                .idle(cadence.getIdle())
                .lowBudgetThreshold(cadence.getLowBudgetThreshold())
                .lowBudgetMultiplier(cadence.getLowBudgetMultiplier())
                .build();
    }

    @Bean
    public RateLimitPolicy rateLimitPolicy(SchedulerProperties properties) {
        SchedulerProperties.RateLimitProperties rateLimit = properties.getRateLimit();
        return new RateLimitPolicy(
                Duration.ofSeconds(rateLimit.getMinSecondsBetweenResponses()),
                rateLimit.getMaxResponsesPerSession());
    }

    @Bean
    public LoopSettings loopSettings(SchedulerProperties properties) {
        SchedulerProperties.LoopProperties loop = properties.getLoop();
        Duration maxGatherWindow = properties.getCoordination().getMaxGatherWindow();
        // a request that cannot outlast the gather window always withdraws before the decision
        if (loop.getTurnRequestTimeout().compareTo(maxGatherWindow) <= 0) {
            throw new IllegalStateException("scheduler.loop.turn-request-timeout ("
                    + loop.getTurnRequestTimeout() + ") must exceed scheduler.coordination.max-gather-window ("
                    + maxGatherWindow + ")");
        }
        return LoopSettings.builder()
                .peekCount(loop.getPeekCount())
                .failureBackoffMultiplier(loop.getFailureBackoffMultiplier())
                .turnRequestTimeout(loop.getTurnRequestTimeout())
                .minimumActivityDuration(loop.getMinimumActivityDuration())
                .build();
    }

    @Bean
    public CoordinationPolicy coordinationPolicy(SchedulerProperties properties) {
        SchedulerProperties.CoordinationProperties coordination = properties.getCoordination();
        return CoordinationPolicy.builder()
                .maxResponders(coordination.getMaxResponders())
                .probabilisticFanOut(coordination.isProbabilisticFanOut())
                .minGatherWindow(coordination.getMinGatherWindow())
                .maxGatherWindow(coordination.getMaxGatherWindow())
                .initialLatency(coordination.getInitialLatency())
                .latencyFactor(coordination.getLatencyFactor())
                .latencySmoothing(coordination.getLatencySmoothing())
                .earlyDecisionConfidence(coordination.getEarlyDecisionConfidence())
                .minConfidence(coordination.getMinConfidence())
                .lowConfidenceFloor(coordination.getLowConfidenceFloor())
                .lowConfidenceAverage(coordination.getLowConfidenceAverage())
                .maxRecencyPenalty(coordination.getMaxRecencyPenalty())
                .recentResponderHistory(coordination.getRecentResponderHistory())
                .retention(coordination.getRetention())
                .cleanupInterval(coordination.getCleanupInterval())
                .build();
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public TurnCoordinator turnCoordinator(CoordinationPolicy coordinationPolicy, Clock clock,
            SpringEventBus eventBus) {
        return new TurnCoordinator(coordinationPolicy, clock, eventBus);
    }

    @Bean
    @ConditionalOnMissingBean(ActionExecutorPort.class)
    public ActionExecutorPort actionExecutorPort(Clock clock) {
        log.info("No ActionExecutorPort provided, persona actions will only be logged");
        return new LoggingActionExecutorAdapter(clock);
    }
}
