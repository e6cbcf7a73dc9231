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

import lombok.Builder;
import lombok.Value;
import me.golemcore.scheduler.domain.model.Mood;

import java.time.Duration;

/**
 * Base rest interval per mood plus the compute budget penalty.
 */
@Value
@Builder(toBuilder = true)
public class CadenceTable {

    @Builder.Default
    Duration overwhelmed = Duration.ofSeconds(10);
    @Builder.Default
    Duration tired = Duration.ofSeconds(7);
    @Builder.Default
    Duration active = Duration.ofSeconds(5);
    @Builder.Default
    Duration idle = Duration.ofSeconds(3);

    /** Budgets below this value stretch the cadence. */
    @Builder.Default
    double lowBudgetThreshold = 0.5;
    @Builder.Default
    long lowBudgetMultiplier = 2;

    public static CadenceTable defaults() {
        return CadenceTable.builder().build();
    }

    public Duration baseFor(Mood mood) {
        return switch (mood) {
            case OVERWHELMED -> overwhelmed;
            case TIRED -> tired;
            case ACTIVE -> active;
            case IDLE -> idle;
        };
    }
}
