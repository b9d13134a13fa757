package com.bank.aml.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeadlineTest {

    @Test
    void after_freshDeadline_hasTimeLeft() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(30));

        assertThat(deadline.isBounded()).isTrue();
        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.remaining()).isPositive().isLessThanOrEqualTo(Duration.ofSeconds(30));
        assertThat(deadline.getBudget()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void after_zeroBudget_isExpiredImmediately() {
        Deadline deadline = Deadline.after(Duration.ZERO);

        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    void after_elapsedBudget_isExpired() throws InterruptedException {
        Deadline deadline = Deadline.after(Duration.ofMillis(5));
        Thread.sleep(20);

        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    void after_budgetBeyondNanosecondRange_saturates() {
        Deadline deadline = Deadline.after(Duration.ofMillis(Long.MAX_VALUE));

        assertThat(deadline.isBounded()).isTrue();
        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.remaining()).isGreaterThan(Duration.ofDays(365L * 200));
        assertThat(deadline.getBudget()).isEqualTo(Duration.ofMillis(Long.MAX_VALUE));
    }

    @Test
    void after_negativeBudget_rejected() {
        assertThatThrownBy(() -> Deadline.after(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void none_neverExpires() {
        Deadline deadline = Deadline.none();

        assertThat(deadline.isBounded()).isFalse();
        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.getBudget()).isNull();
    }
}
