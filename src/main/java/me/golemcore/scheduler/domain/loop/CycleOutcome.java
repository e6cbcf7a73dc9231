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

/**
 * What a single scheduling cycle ended with.
 */
public enum CycleOutcome {

    /** Nothing in the inbox passed the rate limit and engagement checks. */
    NO_CANDIDATE,

    /** The coordinator granted the turn to other personas. */
    DENIED,

    /** No decision within the request timeout; the candidate stays queued. */
    TIMED_OUT,

    ACTED,

    /** Turn granted but the action reported or threw a failure. */
    ACTION_FAILED
}
