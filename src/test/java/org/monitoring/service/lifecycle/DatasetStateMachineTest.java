package org.monitoring.service.lifecycle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.monitoring.models.enums.DatasetStatus;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for DatasetStateMachine.
 */
@DisplayName("DatasetStateMachine Tests")
class DatasetStateMachineTest {

    @ParameterizedTest
    @DisplayName("Should allow or refuse each transition")
    @CsvSource({
            "UPLOADED, false, ANALYZING, true",
            "UPLOADED, false, CONFIRMED, false",
            "ANALYZING, false, ANALYZED, true",
            "ANALYZING, false, FAILED, true",
            "ANALYZED, false, ANALYZING, true",
            "ANALYZED, false, CONFIRMED, true",
            "ANALYZED, false, INGESTING, false",
            "CONFIRMED, false, INGESTING, true",
            "CONFIRMED, false, ANALYZED, false",
            "INGESTING, false, INGESTED, true",
            "INGESTING, false, ANALYZING, false",
            "INGESTED, false, ANALYZING, false",
            "INGESTED, false, FAILED, false",
            "FAILED, true, ANALYZING, true",
            "FAILED, true, INGESTING, true",
            "FAILED, true, INGESTED, false",
            "FAILED, false, ANALYZING, false",
            "FAILED, false, INGESTING, false"
    })
    void testCanTransition(DatasetStatus from, boolean retryable, DatasetStatus to, boolean expected) {
        assertEquals(expected, DatasetStateMachine.canTransition(from, retryable, to));
    }

    @Test
    @DisplayName("Should refuse transitions with a missing status")
    void testCanTransition_Null() {
        assertFalse(DatasetStateMachine.canTransition(null, false, DatasetStatus.ANALYZING));
        assertFalse(DatasetStateMachine.canTransition(DatasetStatus.UPLOADED, false, null));
    }

    @Test
    @DisplayName("Should treat INGESTED and permanent FAILED as terminal")
    void testIsTerminal() {
        assertTrue(DatasetStateMachine.isTerminal(DatasetStatus.INGESTED, false));
        assertTrue(DatasetStateMachine.isTerminal(DatasetStatus.FAILED, false));
        assertFalse(DatasetStateMachine.isTerminal(DatasetStatus.FAILED, true));
        assertFalse(DatasetStateMachine.isTerminal(DatasetStatus.ANALYZED, false));
        assertTrue(DatasetStateMachine.targets(DatasetStatus.INGESTED).isEmpty());
    }
}
