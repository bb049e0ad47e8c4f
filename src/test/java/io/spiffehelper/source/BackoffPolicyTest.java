package io.spiffehelper.source;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class BackoffPolicyTest {

    @Test
    void defaultsDoubleFromOneSecondCappedAtSixteen() {
        BackoffPolicy policy = BackoffPolicy.defaults();
        Assertions.assertEquals(10, policy.maxAttempts());
        Assertions.assertEquals(Duration.ofSeconds(1), policy.delayAfterAttempt(1));
        Assertions.assertEquals(Duration.ofSeconds(2), policy.delayAfterAttempt(2));
        Assertions.assertEquals(Duration.ofSeconds(4), policy.delayAfterAttempt(3));
        Assertions.assertEquals(Duration.ofSeconds(8), policy.delayAfterAttempt(4));
        Assertions.assertEquals(Duration.ofSeconds(16), policy.delayAfterAttempt(5));
        Assertions.assertEquals(Duration.ofSeconds(16), policy.delayAfterAttempt(9));
        Assertions.assertEquals(Duration.ofSeconds(16), policy.delayAfterAttempt(1_000));
    }

    @Test
    void rejectsInvalidPolicies() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 3));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), 0));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(-1), Duration.ofSeconds(2), 3));
    }
}
