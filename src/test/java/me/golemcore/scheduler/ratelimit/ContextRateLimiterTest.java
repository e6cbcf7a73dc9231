package me.golemcore.scheduler.ratelimit;

import me.golemcore.scheduler.domain.model.RateLimitInfo;
import me.golemcore.scheduler.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextRateLimiterTest {

    private static final String ROOM = "room-1";
    private static final String OTHER_ROOM = "room-2";

    private MutableClock clock;
    private ContextRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        rateLimiter = new ContextRateLimiter("helper", RateLimitPolicy.defaults(), clock);
    }

    @Test
    void shouldNotLimitContextWithoutResponses() {
        assertFalse(rateLimiter.isRateLimited(ROOM));
        assertEquals(0, rateLimiter.getResponseCount(ROOM));
    }

    @Test
    void shouldLimitUntilMinimumIntervalElapses() {
        rateLimiter.recordResponse(ROOM);

        clock.advance(Duration.ofSeconds(5));
        assertTrue(rateLimiter.isRateLimited(ROOM));
        assertEquals(Duration.ofSeconds(5), rateLimiter.getRateLimitInfo(ROOM).getWaitTime());

        clock.advance(Duration.ofMillis(5001));
        assertFalse(rateLimiter.isRateLimited(ROOM));
        assertEquals(Duration.ZERO, rateLimiter.getRateLimitInfo(ROOM).getWaitTime());
    }

    @Test
    void shouldKeepContextsIndependent() {
        rateLimiter.recordResponse(ROOM);

        assertTrue(rateLimiter.isRateLimited(ROOM));
        assertFalse(rateLimiter.isRateLimited(OTHER_ROOM));
    }

    @Test
    void shouldLimitIndefinitelyOnceResponseCapReached() {
        rateLimiter = new ContextRateLimiter("helper", new RateLimitPolicy(Duration.ofSeconds(1), 3), clock);
        for (int i = 0; i < 3; i++) {
            rateLimiter.recordResponse(ROOM);
            clock.advance(Duration.ofSeconds(2));
        }

        clock.advance(Duration.ofHours(1));

        assertTrue(rateLimiter.hasReachedResponseCap(ROOM));
        assertTrue(rateLimiter.isRateLimited(ROOM));
        RateLimitInfo info = rateLimiter.getRateLimitInfo(ROOM);
        assertTrue(info.isResponseCapReached());
        assertTrue(info.isRateLimited());
        assertEquals(3, info.getResponseCount());
        assertEquals(3, info.getMaxResponses());
    }

    @Test
    void shouldStartFreshSessionAfterReset() {
        rateLimiter = new ContextRateLimiter("helper", new RateLimitPolicy(Duration.ofSeconds(1), 1), clock);
        rateLimiter.recordResponse(ROOM);
        rateLimiter.recordResponse(OTHER_ROOM);
        assertTrue(rateLimiter.isRateLimited(ROOM));

        rateLimiter.reset(ROOM);

        assertFalse(rateLimiter.isRateLimited(ROOM));
        assertEquals(0, rateLimiter.getResponseCount(ROOM));
        assertTrue(rateLimiter.isRateLimited(OTHER_ROOM));

        rateLimiter.resetAll();
        assertFalse(rateLimiter.isRateLimited(OTHER_ROOM));
    }

    @Test
    void shouldCountResponsesPerContext() {
        rateLimiter.recordResponse(ROOM);
        rateLimiter.recordResponse(ROOM);
        rateLimiter.recordResponse(OTHER_ROOM);

        assertEquals(2, rateLimiter.getResponseCount(ROOM));
        assertEquals(1, rateLimiter.getResponseCount(OTHER_ROOM));
    }

    @Test
    void shouldListRateLimitInfoSortedByContext() {
        rateLimiter.recordResponse(OTHER_ROOM);
        rateLimiter.recordResponse(ROOM);

        List<RateLimitInfo> all = rateLimiter.getAllRateLimitInfo();

        assertEquals(List.of(ROOM, OTHER_ROOM), all.stream().map(RateLimitInfo::getContextId).toList());
        assertEquals(clock.instant(), all.get(0).getLastResponseTime());
    }

    @Test
    void shouldRejectInvalidPolicy() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitPolicy(Duration.ofSeconds(-1), 5));
        assertThrows(IllegalArgumentException.class, () -> new RateLimitPolicy(Duration.ofSeconds(1), 0));
    }
}
