package com.vtb.supplychain.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineTest {

    @Test
    void capNeverExceedsRemainingBudget() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(1));
        assertTrue(deadline.cap(Duration.ofSeconds(30)).compareTo(Duration.ofSeconds(1)) <= 0);
        assertEquals(Duration.ofMillis(10), deadline.cap(Duration.ofMillis(10)));
        assertFalse(deadline.isExpired());
    }

    @Test
    void zeroOrNegativeBudgetIsExpired() {
        assertTrue(Deadline.after(Duration.ZERO).isExpired());
        assertTrue(Deadline.after(Duration.ofSeconds(-5)).isExpired());
        assertEquals(Duration.ZERO, Deadline.after(Duration.ZERO).cap(Duration.ofSeconds(1)));
    }

    @Test
    void hugeBudgetDoesNotOverflow() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(Long.MAX_VALUE));
        assertFalse(deadline.isExpired());
        assertEquals(Duration.ofSeconds(5), deadline.cap(Duration.ofSeconds(5)));
    }
}
