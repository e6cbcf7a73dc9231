package me.golemcore.scheduler.port.outbound;

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

import me.golemcore.scheduler.domain.model.ActionResult;
import me.golemcore.scheduler.domain.model.InboxEvent;

/**
 * Port through which a persona that was granted a turn performs its action
 * (generate and post a reply, run a tool, ...). The scheduler is agnostic to
 * what the action does.
 *
 * <p>
 * Implementations report failure either by returning an unsuccessful
 * {@link ActionResult} or by throwing {@link ActionExecutionException}; both
 * are logged and accounted as activity, and neither stops the persona's loop.
 */
public interface ActionExecutorPort {

    /**
     * Perform the action for the persona on the event.
     */
    ActionResult execute(String agentId, InboxEvent event);
}
