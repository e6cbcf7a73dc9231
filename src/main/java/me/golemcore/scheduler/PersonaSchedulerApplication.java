package me.golemcore.scheduler;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the persona scheduler.
 *
 * <p>
 * Runs a pool of autonomous personas. Each persona owns a bounded priority
 * inbox, an internal energy/mood model that sets its rhythm, and per-context
 * rate limits. Personas reacting to the same trigger are arbitrated by a
 * shared turn coordinator so that only a bounded subset acts.
 *
 * <pre>
 * Ingestion      → EventsController, PersonaRuntimeService, MessagePriorityCalculator
 * Domain         → PersonaSchedulerLoop, PersonaStateManager, EventInbox, RateLimiter
 * Coordination   → TurnCoordinator, TurnArbiter, AdaptiveGatherWindow
 * Outbound       → ActionExecutorPort
 * </pre>
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PersonaSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PersonaSchedulerApplication.class, args);
    }
}
