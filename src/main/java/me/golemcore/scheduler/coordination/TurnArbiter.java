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

import me.golemcore.scheduler.domain.model.PersonaRole;
import me.golemcore.scheduler.domain.model.RejectionReason;
import me.golemcore.scheduler.domain.model.TurnDecision;
import me.golemcore.scheduler.domain.model.TurnIntent;
import me.golemcore.scheduler.domain.model.TurnRejection;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Decision rule for a closed gathering window.
 *
 * <p>
 * Intents are ranked by role weight, then by confidence minus a recency
 * penalty, then by registration order. The top-ranked intents meeting the
 * minimum confidence receive the available slots. A lone intent is always
 * granted. When every intent is weak the minimum confidence drops to the
 * configured floor so that a conversation is not left unanswered.
 *
 * <p>
 * Stateless; all inputs are passed per call.
 */
class TurnArbiter {

    private final CoordinationPolicy policy;

    TurnArbiter(CoordinationPolicy policy) {
        this.policy = policy;
    }

    TurnDecision decide(ArbitrationRequest request) {
        List<TurnIntent> intents = request.intents();
        boolean moderatorPresent = intents.stream().anyMatch(i -> i.role() == PersonaRole.MODERATOR);
        List<String> recent = moderatorPresent ? List.of() : request.recentResponders();

        List<TurnIntent> ranked = new ArrayList<>(intents);
        ranked.sort(Comparator
                .comparingInt((TurnIntent i) -> i.role().getWeight()).reversed()
                .thenComparing(Comparator.comparingDouble(
                        (TurnIntent i) -> i.confidence() - recencyPenalty(i.agentId(), recent)).reversed())
                .thenComparingLong(TurnIntent::sequence));

        List<String> granted = new ArrayList<>();
        List<String> denied = new ArrayList<>();
        List<TurnRejection> rejections = new ArrayList<>();
        List<String> reasoning = new ArrayList<>();

        if (ranked.size() == 1) {
            TurnIntent only = ranked.get(0);
            granted.add(only.agentId());
            reasoning.add(only.agentId() + " is the only claimant (conf=" + format(only.confidence())
                    + ") - auto-granted");
        } else if (ranked.isEmpty()) {
            reasoning.add("No active intents");
        } else {
            double threshold = effectiveMinConfidence(ranked);
            for (int rank = 0; rank < ranked.size(); rank++) {
                TurnIntent intent = ranked.get(rank);
                if (intent.confidence() < threshold) {
                    denied.add(intent.agentId());
                    rejections.add(new TurnRejection(intent.agentId(), RejectionReason.LOW_CONFIDENCE,
                            intent.confidence(), intent.role(),
                            "Confidence " + format(intent.confidence()) + " below threshold " + format(threshold)));
                    reasoning.add(intent.agentId() + " below threshold (conf=" + format(intent.confidence()) + ")");
                } else if (granted.size() < request.slots()) {
                    granted.add(intent.agentId());
                    reasoning.add(intent.agentId() + " granted (conf=" + format(intent.confidence())
                            + ", penalty=" + format(recencyPenalty(intent.agentId(), recent)) + ")");
                } else {
                    denied.add(intent.agentId());
                    rejections.add(new TurnRejection(intent.agentId(), RejectionReason.OUTRANKED,
                            intent.confidence(), intent.role(),
                            "Ranked " + (rank + 1) + "/" + ranked.size() + ", only " + request.slots()
                                    + " slot(s) available"));
                }
            }
        }

        for (TurnIntent withdrawn : request.withdrawn()) {
            denied.add(withdrawn.agentId());
            rejections.add(new TurnRejection(withdrawn.agentId(), RejectionReason.WITHDRAWN,
                    withdrawn.confidence(), withdrawn.role(), "Intent withdrawn before decision"));
        }

        return TurnDecision.builder()
                .triggerId(request.triggerId())
                .contextId(request.contextId())
                .granted(List.copyOf(granted))
                .denied(List.copyOf(denied))
                .rejections(List.copyOf(rejections))
                .intents(List.copyOf(intents))
                .slots(request.slots())
                .reasoning(String.join("; ", reasoning))
                .decidedAt(request.decidedAt())
                .coordinationDuration(Duration.between(request.startedAt(), request.decidedAt()))
                .build();
    }

    double recencyPenalty(String agentId, List<String> recent) {
        int position = recent.indexOf(agentId);
        if (position < 0) {
            return 0.0;
        }
        double recencyFactor = 1.0 - ((double) position / Math.max(recent.size(), 1));
        return policy.getMaxRecencyPenalty() * recencyFactor;
    }

    private double effectiveMinConfidence(Collection<TurnIntent> intents) {
        double average = intents.stream().mapToDouble(TurnIntent::confidence).average().orElse(0.0);
        return average < policy.getLowConfidenceAverage()
                ? Math.min(policy.getLowConfidenceFloor(), policy.getMinConfidence())
                : policy.getMinConfidence();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    record ArbitrationRequest(String triggerId, String contextId, List<TurnIntent> intents,
            List<TurnIntent> withdrawn, int slots, List<String> recentResponders, Instant startedAt,
            Instant decidedAt) {
    }
}
