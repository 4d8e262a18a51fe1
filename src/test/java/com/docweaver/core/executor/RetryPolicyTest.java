package com.docweaver.core.executor;

import com.docweaver.core.gateway.FatalAgentException;
import com.docweaver.core.gateway.TransientAgentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final TransientAgentException transientError =
            new TransientAgentException(TransientAgentException.RATE_LIMITED, "slow down");
    private final FatalAgentException fatalError =
            new FatalAgentException(FatalAgentException.REJECTED, "no");

    @Test
    @DisplayName("retries transient failures until attempts run out")
    void retriesTransient() {
        var policy = RetryPolicy.defaults();

        assertTrue(policy.shouldRetry(1, transientError));
        assertTrue(policy.shouldRetry(2, transientError));
        assertFalse(policy.shouldRetry(3, transientError));
    }

    @Test
    @DisplayName("never retries fatal failures")
    void neverRetriesFatal() {
        assertFalse(RetryPolicy.defaults().shouldRetry(1, fatalError));
        assertFalse(RetryPolicy.defaults().shouldRetry(1, new IllegalStateException("bug")));
    }

    @Test
    @DisplayName("delays grow exponentially and are capped")
    void exponentialBackoff() {
        var policy = new RetryPolicy(6, Duration.ofMillis(100), 3.0, Duration.ofMillis(1000), null);

        assertEquals(Duration.ofMillis(100), policy.delayAfter(1));
        assertEquals(Duration.ofMillis(300), policy.delayAfter(2));
        assertEquals(Duration.ofMillis(900), policy.delayAfter(3));
        assertEquals(Duration.ofMillis(1000), policy.delayAfter(4));
    }

    @Test
    @DisplayName("noRetry allows a single attempt")
    void noRetry() {
        assertFalse(RetryPolicy.noRetry().shouldRetry(1, transientError));
    }

    @Test
    @DisplayName("rejects invalid settings")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ZERO, 2.0, Duration.ZERO, null));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ZERO, 0.5, Duration.ZERO, null));
    }
}
