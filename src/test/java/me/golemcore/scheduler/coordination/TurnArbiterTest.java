package me.golemcore.scheduler.coordination;

import me.golemcore.scheduler.domain.model.PersonaRole;
import me.golemcore.scheduler.domain.model.RejectionReason;
import me.golemcore.scheduler.domain.model.TurnDecision;
import me.golemcore.scheduler.domain.model.TurnIntent;
import me.golemcore.scheduler.domain.model.TurnRejection;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TurnArbiterTest {

    private static final Instant STARTED = Instant.parse("2026-01-01T00:00:00Z");
    private static final Instant DECIDED = STARTED.plusSeconds(2);

    private final TurnArbiter arbiter = new TurnArbiter(CoordinationPolicy.defaults());

    @Test
    void shouldGrantHighestConfidenceWithSingleSlot() {
        TurnDecision decision = decide(1, List.of(),
                intent("a", 0.6, PersonaRole.PARTICIPANT, 1),
                intent("b", 0.9, PersonaRole.PARTICIPANT, 2));

        assertEquals(List.of("b"), decision.getGranted());
        assertEquals(List.of("a"), decision.getDenied());
        assertEquals(RejectionReason.OUTRANKED, decision.getRejections().get(0).reason());
        assertEquals(Duration.ofSeconds(2), decision.getCoordinationDuration());
    }

    @Test
    void shouldBreakConfidenceTiesByRegistrationOrder() {
        TurnDecision decision = decide(1, List.of(),
                intent("late", 0.7, PersonaRole.PARTICIPANT, 5),
                intent("early", 0.7, PersonaRole.PARTICIPANT, 3));

        assertEquals(List.of("early"), decision.getGranted());
    }

    @Test
    void shouldGrantUpToSlots() {
        TurnDecision decision = decide(2, List.of(),
                intent("a", 0.5, PersonaRole.PARTICIPANT, 1),
                intent("b", 0.8, PersonaRole.PARTICIPANT, 2),
                intent("c", 0.7, PersonaRole.PARTICIPANT, 3));

        assertEquals(List.of("b", "c"), decision.getGranted());
        assertEquals(List.of("a"), decision.getDenied());
    }

    @Test
    void shouldRankRoleWeightAboveConfidence() {
        TurnDecision decision = decide(1, List.of(),
                intent("participant", 0.95, PersonaRole.PARTICIPANT, 1),
                intent("expert", 0.5, PersonaRole.EXPERT, 2));

        assertEquals(List.of("expert"), decision.getGranted());
    }

    @Test
    void shouldDemoteRecentResponder() {
        TurnDecision decision = decide(1, List.of("a"),
                intent("a", 0.8, PersonaRole.PARTICIPANT, 1),
                intent("b", 0.6, PersonaRole.PARTICIPANT, 2));

        assertEquals(List.of("b"), decision.getGranted());
    }

    @Test
    void shouldIgnoreRecencyWhenModeratorClaims() {
        TurnDecision decision = decide(2, List.of("a"),
                intent("mod", 0.5, PersonaRole.MODERATOR, 1),
                intent("a", 0.8, PersonaRole.PARTICIPANT, 2),
                intent("b", 0.6, PersonaRole.PARTICIPANT, 3));

        assertEquals(List.of("mod", "a"), decision.getGranted());
    }

    @Test
    void shouldScalePenaltyByPositionInHistory() {
        List<String> recent = List.of("x", "y", "z", "w");

        assertEquals(0.5, arbiter.recencyPenalty("x", recent), 1e-9);
        assertEquals(0.25, arbiter.recencyPenalty("z", recent), 1e-9);
        assertEquals(0.0, arbiter.recencyPenalty("other", recent), 1e-9);
    }

    @Test
    void shouldAutoGrantLoneClaimantRegardlessOfConfidence() {
        TurnDecision decision = decide(1, List.of(), intent("solo", 0.05, PersonaRole.OBSERVER, 1));

        assertEquals(List.of("solo"), decision.getGranted());
        assertTrue(decision.getRejections().isEmpty());
    }

    @Test
    void shouldDenyLowConfidenceIntents() {
        TurnDecision decision = decide(3, List.of(),
                intent("a", 0.9, PersonaRole.PARTICIPANT, 1),
                intent("b", 0.25, PersonaRole.PARTICIPANT, 2));

        assertEquals(List.of("a"), decision.getGranted());
        TurnRejection rejection = decision.getRejections().get(0);
        assertEquals("b", rejection.agentId());
        assertEquals(RejectionReason.LOW_CONFIDENCE, rejection.reason());
    }

    @Test
    void shouldLowerThresholdWhenAllIntentsAreWeak() {
        TurnDecision decision = decide(2, List.of(),
                intent("a", 0.25, PersonaRole.PARTICIPANT, 1),
                intent("b", 0.22, PersonaRole.PARTICIPANT, 2));

        assertEquals(List.of("a", "b"), decision.getGranted());
    }

    @Test
    void shouldReportWithdrawnIntents() {
        TurnIntent withdrawn = intent("gone", 0.7, PersonaRole.EXPERT, 1);
        TurnDecision decision = arbiter.decide(new TurnArbiter.ArbitrationRequest("T1", "room", List.of(),
                List.of(withdrawn), 1, List.of(), STARTED, DECIDED));

        assertTrue(decision.getGranted().isEmpty());
        assertEquals(List.of("gone"), decision.getDenied());
        assertEquals(RejectionReason.WITHDRAWN, decision.getRejections().get(0).reason());
        assertEquals("No active intents", decision.getReasoning());
    }

    private TurnDecision decide(int slots, List<String> recent, TurnIntent... intents) {
        return arbiter.decide(new TurnArbiter.ArbitrationRequest("T1", "room", new ArrayList<>(List.of(intents)),
                List.of(), slots, recent, STARTED, DECIDED));
    }

    private static TurnIntent intent(String agentId, double confidence, PersonaRole role, long sequence) {
        return new TurnIntent(agentId, confidence, role, STARTED, sequence);
    }
}
