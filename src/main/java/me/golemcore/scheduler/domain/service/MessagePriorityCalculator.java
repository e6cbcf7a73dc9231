package me.golemcore.scheduler.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.domain.model.PrioritySignals;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Scores a message for a persona in [0, 1].
 *
 * <p>
 * Score = base + mention boost + freshness + quiet-room boost + voice boost,
 * clamped to [0, 1]. Freshness decays linearly to zero over one minute. The
 * quiet-room boost shrinks as the room gets busier. A direct mention on a
 * voice channel always lands above the always-engage threshold.
 */
@Service
@RequiredArgsConstructor
public class MessagePriorityCalculator {

    static final double BASE = 0.2;
    static final double MENTION_BOOST = 0.45;
    static final double RECENCY_WEIGHT = 0.2;
    static final Duration RECENCY_HORIZON = Duration.ofMinutes(1);
    static final double QUIET_ROOM_BOOST = 0.1;
    static final int BUSY_ROOM_MESSAGES = 10;
    static final double VOICE_BOOST = 0.2;

    private final Clock clock;

    public double calculate(PrioritySignals signals) {
        double score = BASE;
        if (signals.isMentioned()) {
            score += MENTION_BOOST;
        }
        score += RECENCY_WEIGHT * freshness(signals.getSentAt());

        int roomMessages = Math.max(0, signals.getRecentRoomMessages());
        double busyness = Math.min(1.0, roomMessages / (double) BUSY_ROOM_MESSAGES);
        score += QUIET_ROOM_BOOST * (1.0 - busyness);

        if (signals.isVoice()) {
            score += VOICE_BOOST;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private double freshness(Instant sentAt) {
        if (sentAt == null) {
            return 0.0;
        }
        long ageMs = Math.max(0, Duration.between(sentAt, clock.instant()).toMillis());
        double horizonMs = RECENCY_HORIZON.toMillis();
        return Math.max(0.0, 1.0 - ageMs / horizonMs);
    }
}
