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
import lombok.Value;

import java.time.Duration;

/**
 * Per-loop tuning shared by all personas.
 */
@Value
@Builder
public class LoopSettings {

    /** How many top inbox entries are evaluated per cycle. */
    @Builder.Default
    int peekCount = 5;

    /** Upper bound on waiting for a turn decision. */
    @Builder.Default
    Duration turnRequestTimeout = Duration.ofSeconds(25);

    /** Cadence multiplier applied after an unexpected loop failure. */
    @Builder.Default
    long failureBackoffMultiplier = 2;

    /** Floor for the duration accounted against energy per action. */
    @Builder.Default
    Duration minimumActivityDuration = Duration.ofSeconds(3);

    public static LoopSettings defaults() {
        return LoopSettings.builder().build();
    }
}
