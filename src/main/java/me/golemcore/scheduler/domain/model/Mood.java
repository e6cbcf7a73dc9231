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

/**
 * Derived disposition of a persona.
 *
 * <p>
 * Each mood carries the minimum event priority the persona needs before it
 * engages. Thresholds rise as load and fatigue rise: idle &lt; active &lt;
 * tired &lt; overwhelmed.
 */
public enum Mood {

    IDLE(0.1),
    ACTIVE(0.3),
    TIRED(0.5),
    OVERWHELMED(0.9);

    private final double engagementThreshold;

    Mood(double engagementThreshold) {
        this.engagementThreshold = engagementThreshold;
    }

    public double getEngagementThreshold() {
        return engagementThreshold;
    }
}
