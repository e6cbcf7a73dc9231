package me.golemcore.scheduler.domain.model;

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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Final, immutable outcome of turn arbitration for one trigger.
 *
 * <p>
 * Every persona that asks about the trigger after the decision receives this
 * same instance. Personas absent from {@code granted} are denied, including
 * those that arrived after the decision was made.
 *
 * @since 1.0
 */
@Value
@Builder
public class TurnDecision {

    String triggerId;
    String contextId;
    List<String> granted;
    List<String> denied;
    List<TurnRejection> rejections;
    List<TurnIntent> intents;
    int slots;
    String reasoning;
    Instant decidedAt;
    Duration coordinationDuration;

    public boolean isGranted(String agentId) {
        return granted.contains(agentId);
    }
}
