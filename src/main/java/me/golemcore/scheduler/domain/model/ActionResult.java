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
import lombok.Data;

import java.time.Duration;

/**
 * Result of executing an action on behalf of a persona.
 *
 * <p>
 * Factory methods {@link #success(Duration)} and
 * {@link #failure(String, Duration)} cover the common cases.
 *
 * @since 1.0
 */
@Data
@Builder
public class ActionResult {

    private boolean success;
    private String message;
    private Duration duration;

    /**
     * Relative effort of the action in {@code [0, 1]}; {@code null} lets the
     * scheduler fall back to the event priority.
     */
    private Double complexity;

    public static ActionResult success(Duration duration) {
        return ActionResult.builder()
                .success(true)
                .duration(duration)
                .build();
    }

    public static ActionResult failure(String message, Duration duration) {
        return ActionResult.builder()
                .success(false)
                .message(message)
                .duration(duration)
                .build();
    }
}
