package me.golemcore.scheduler.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.scheduler.adapter.outbound.action.LoggingActionExecutorAdapter;
import me.golemcore.scheduler.coordination.CoordinationPolicy;
import me.golemcore.scheduler.coordination.TurnCoordinator;
import me.golemcore.scheduler.domain.loop.LoopSettings;
import me.golemcore.scheduler.domain.model.Mood;
import me.golemcore.scheduler.infrastructure.event.SpringEventBus;
import me.golemcore.scheduler.persona.CadenceTable;
import me.golemcore.scheduler.ratelimit.RateLimitPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class AutoConfigurationTest {

    private SchedulerProperties properties;
    private AutoConfiguration autoConfiguration;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        autoConfiguration = new AutoConfiguration();
    }

    @Test
    void shouldBuildCadenceTableFromProperties() {
        properties.getCadence().setIdle(Duration.ofSeconds(1));
        properties.getCadence().setLowBudgetMultiplier(3);

        CadenceTable table = autoConfiguration.cadenceTable(properties);

        assertEquals(Duration.ofSeconds(1), table.baseFor(Mood.IDLE));
        assertEquals(Duration.ofSeconds(10), table.baseFor(Mood.OVERWHELMED));
        assertEquals(3, table.getLowBudgetMultiplier());
    }

    @Test
    void shouldBuildRateLimitPolicyFromProperties() {
        properties.getRateLimit().setMinSecondsBetweenResponses(30);
        properties.getRateLimit().setMaxResponsesPerSession(5);

        RateLimitPolicy policy = autoConfiguration.rateLimitPolicy(properties);

        assertEquals(Duration.ofSeconds(30), policy.getMinIntervalBetweenResponses());
        assertEquals(5, policy.getMaxResponsesPerSession());
    }

    @Test
    void shouldBuildLoopSettingsFromProperties() {
        properties.getLoop().setPeekCount(2);
        properties.getLoop().setTurnRequestTimeout(Duration.ofSeconds(5));
        properties.getCoordination().setMaxGatherWindow(Duration.ofSeconds(4));

        LoopSettings settings = autoConfiguration.loopSettings(properties);

        assertEquals(2, settings.getPeekCount());
        assertEquals(Duration.ofSeconds(5), settings.getTurnRequestTimeout());
        assertEquals(2, settings.getFailureBackoffMultiplier());
    }

    @Test
    void shouldRejectTurnTimeoutThatCannotOutlastGatherWindow() {
        properties.getLoop().setTurnRequestTimeout(Duration.ofSeconds(20));
        properties.getCoordination().setMaxGatherWindow(Duration.ofSeconds(20));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> autoConfiguration.loopSettings(properties));
        assertTrue(error.getMessage().contains("turn-request-timeout"));
    }

    @Test
    void shouldAcceptDefaultLoopAndCoordinationTimings() {
        assertEquals(Duration.ofSeconds(25), autoConfiguration.loopSettings(properties).getTurnRequestTimeout());
    }

    @Test
    void shouldMirrorDefaultCoordinationPolicy() {
        assertEquals(CoordinationPolicy.defaults(), autoConfiguration.coordinationPolicy(properties));

        properties.getCoordination().setMaxResponders(3);
        properties.getCoordination().setProbabilisticFanOut(true);
        CoordinationPolicy policy = autoConfiguration.coordinationPolicy(properties);
        assertEquals(3, policy.getMaxResponders());
        assertTrue(policy.isProbabilisticFanOut());
    }

    @Test
    void shouldCreateCoordinatorWithConfiguredWindow() {
        properties.getCoordination().setInitialLatency(Duration.ofSeconds(6));
        TurnCoordinator coordinator = autoConfiguration.turnCoordinator(
                autoConfiguration.coordinationPolicy(properties), Clock.systemUTC(), mock(SpringEventBus.class));
        try {
            assertEquals(Duration.ofSeconds(6), coordinator.getCurrentGatherWindow());
        } finally {
            coordinator.shutdown();
        }
    }

    @Test
    void shouldFallBackToLoggingActionExecutor() {
        assertInstanceOf(LoggingActionExecutorAdapter.class, autoConfiguration.actionExecutorPort(Clock.systemUTC()));
    }

    @Test
    void shouldSerializeInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("\"2026-01-01T00:00:00Z\"", mapper.writeValueAsString(Instant.parse("2026-01-01T00:00:00Z")));
    }
}
