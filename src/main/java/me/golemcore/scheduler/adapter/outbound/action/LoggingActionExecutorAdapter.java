package me.golemcore.scheduler.adapter.outbound.action;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.ActionResult;
import me.golemcore.scheduler.domain.model.InboxEvent;
import me.golemcore.scheduler.port.outbound.ActionExecutorPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fallback {@link ActionExecutorPort} used when the host application does not
 * provide one. Logs the granted turn and reports success.
 */
@Slf4j
public class LoggingActionExecutorAdapter implements ActionExecutorPort {

    private final Clock clock;

    public LoggingActionExecutorAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ActionResult execute(String agentId, InboxEvent event) {
        Instant start = clock.instant();
        log.info("[Action] {} acts on event {} in context {} (priority={})",
                agentId, event.getId(), event.getContextId(), event.getPriority());
        return ActionResult.success(Duration.between(start, clock.instant()));
    }
}
