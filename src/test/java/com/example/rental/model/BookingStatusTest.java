package com.example.rental.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookingStatusTest {

    @Test
    void activeStatusesHoldCapacity() {
        assertThat(BookingStatus.ACTIVE).containsExactlyInAnyOrder(
                BookingStatus.PENDING, BookingStatus.CONFIRMED, BookingStatus.CHANGED, BookingStatus.RESCHEDULED);
        assertThat(BookingStatus.CANCELED.isActive()).isFalse();
        assertThat(BookingStatus.COMPLETED.isActive()).isFalse();
    }

    @Test
    void terminalStatusesGoNowhere() {
        for (BookingStatus target : BookingStatus.values()) {
            assertThat(BookingStatus.CANCELED.canTransitionTo(target)).isFalse();
            assertThat(BookingStatus.COMPLETED.canTransitionTo(target)).isFalse();
        }
    }

    @Test
    void reopenOnlyFromConfirmed() {
        assertThat(BookingStatus.sourcesOf(BookingStatus.PENDING)).containsExactly(BookingStatus.CONFIRMED);
    }

    @Test
    void completeOnlyFromConfirmed() {
        assertThat(BookingStatus.sourcesOf(BookingStatus.COMPLETED)).containsExactly(BookingStatus.CONFIRMED);
        assertThat(BookingStatus.PENDING.canTransitionTo(BookingStatus.COMPLETED)).isFalse();
    }

    @Test
    void decodesCodes() {
        assertThat(BookingStatus.fromCode("rescheduled")).isEqualTo(BookingStatus.RESCHEDULED);
        assertThat(BookingStatus.fromCode("CONFIRMED")).isEqualTo(BookingStatus.CONFIRMED);
        assertThatThrownBy(() -> BookingStatus.fromCode("lost")).isInstanceOf(IllegalArgumentException.class);
    }
}
