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
 * Standing of a persona within a conversation. Turn arbitration ranks by role
 * weight before confidence, so a moderator always outranks an expert, and so
 * on.
 */
public enum PersonaRole {

    MODERATOR(1000),
    EXPERT(100),
    PARTICIPANT(10),
    OBSERVER(1);

    private final int weight;

    PersonaRole(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}
