package me.golemcore.scheduler.coordination;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling list of personas granted a turn per context, most recent first.
 * Used to rotate turns so one persona does not dominate a conversation.
 */
class RecentResponders {

    private final int history;
    private final Map<String, List<String>> respondersByContext = new ConcurrentHashMap<>();

    RecentResponders(int history) {
        this.history = Math.max(1, history);
    }

    void record(String contextId, String agentId) {
        respondersByContext.compute(contextId, (key, existing) -> {
            List<String> updated = new ArrayList<>(history + 1);
            updated.add(agentId);
            if (existing != null) {
                for (String previous : existing) {
                    if (!previous.equals(agentId) && updated.size() < history) {
                        updated.add(previous);
                    }
                }
            }
            return List.copyOf(updated);
        });
    }

    List<String> get(String contextId) {
        return respondersByContext.getOrDefault(contextId, List.of());
    }
}
