package com.example.rental.dto;

import com.example.rental.model.ConversationStep;
import com.example.rental.model.ScratchKeys;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScratchDataTest {

    @Test
    void datesAreStoredAsIsoStrings() {
        ScratchData data = new ScratchData().put(ScratchKeys.DATE, LocalDate.of(2025, 3, 1));
        assertThat(data.asMap()).containsEntry(ScratchKeys.DATE, "2025-03-01");
        assertThat(data.getDate(ScratchKeys.DATE)).isEqualTo(LocalDate.of(2025, 3, 1));
    }

    @Test
    void readsValuesAsJsonWouldDecodeThem() {
        ScratchData data = new ScratchData(Map.of(
                ScratchKeys.ITEM_ID, 7,
                ScratchKeys.DATES, List.of("2025-03-01", "2025-03-02"),
                ScratchKeys.IS_MANAGER_BOOKING, "true"));

        assertThat(data.getLong(ScratchKeys.ITEM_ID)).isEqualTo(7L);
        assertThat(data.getDates(ScratchKeys.DATES)).hasSize(2);
        assertThat(data.getBoolean(ScratchKeys.IS_MANAGER_BOOKING)).isTrue();
        assertThat(data.getLong(ScratchKeys.PHONE)).isNull();
    }

    @Test
    void copyIsIndependent() {
        ScratchData original = new ScratchData().put(ScratchKeys.PAGE, 1);
        ScratchData copy = original.copy().put(ScratchKeys.PAGE, 2);
        assertThat(original.getInt(ScratchKeys.PAGE, 0)).isEqualTo(1);
        assertThat(copy.getInt(ScratchKeys.PAGE, 0)).isEqualTo(2);
    }

    @Test
    void stateIsConsistentOnlyWithRequiredKeys() {
        ScratchData partial = new ScratchData().put(ScratchKeys.ITEM_ID, 1L);
        assertThat(new ConversationState(1, ConversationStep.ENTER_NAME, partial, null).isConsistent()).isFalse();
        partial.put(ScratchKeys.DATE, LocalDate.of(2025, 1, 1));
        assertThat(new ConversationState(1, ConversationStep.ENTER_NAME, partial, null).isConsistent()).isTrue();
    }
}
