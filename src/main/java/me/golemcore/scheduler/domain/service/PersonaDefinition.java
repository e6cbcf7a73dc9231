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

import lombok.Builder;
import lombok.Value;
import me.golemcore.scheduler.domain.model.PersonaRole;
import me.golemcore.scheduler.persona.CadenceTable;
import me.golemcore.scheduler.ratelimit.RateLimitPolicy;

/**
 * Fully resolved settings of one persona. Fields left unset in
 * configuration are filled from the scheduler-wide defaults before a
 * definition is built.
 */
@Value
@Builder
public class PersonaDefinition {

    String agentId;
    @Builder.Default
    PersonaRole role = PersonaRole.PARTICIPANT;
    @Builder.Default
    double computeBudget = 1.0;
    int inboxCapacity;
    RateLimitPolicy rateLimitPolicy;
    CadenceTable cadenceTable;
}
