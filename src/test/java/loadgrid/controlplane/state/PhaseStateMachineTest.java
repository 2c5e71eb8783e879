package loadgrid.controlplane.state;

import loadgrid.controlplane.model.RunPhase;
import loadgrid.controlplane.model.RunStatus;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class PhaseStateMachineTest {

    @Test
    void statusRankNeverDecreases() {
        assertTrue(PhaseStateMachine.acceptStatus(RunStatus.PREPARED, RunStatus.STARTING));
        assertTrue(PhaseStateMachine.acceptStatus(RunStatus.STARTING, RunStatus.RUNNING));
        assertTrue(PhaseStateMachine.acceptStatus(RunStatus.RUNNING, RunStatus.CANCELLING));
        assertTrue(PhaseStateMachine.acceptStatus(RunStatus.STOPPING, RunStatus.CANCELLING));
        assertTrue(PhaseStateMachine.acceptStatus(RunStatus.CANCELLING, RunStatus.CANCELLED));

        assertFalse(PhaseStateMachine.acceptStatus(RunStatus.RUNNING, RunStatus.STARTING));
        assertFalse(PhaseStateMachine.acceptStatus(RunStatus.COMPLETED, RunStatus.RUNNING));
        assertFalse(PhaseStateMachine.acceptStatus(RunStatus.CANCELLING, RunStatus.RUNNING));
    }

    @Test
    void preparedAndStartingShareARank() {
        assertEquals(PhaseStateMachine.statusRank("PREPARED"), PhaseStateMachine.statusRank("STARTING"));
        assertTrue(PhaseStateMachine.acceptStatus("STARTING", "PREPARED"));
    }

    @Test
    void blankOrMissingValues() {
        assertFalse(PhaseStateMachine.acceptStatus("RUNNING", ""));
        assertFalse(PhaseStateMachine.acceptStatus("RUNNING", null));
        assertTrue(PhaseStateMachine.acceptStatus(null, "RUNNING"));
        assertFalse(PhaseStateMachine.acceptPhase("RUNNING", " ", "RUNNING"));
    }

    @Test
    void statusIsCaseInsensitive() {
        assertTrue(PhaseStateMachine.acceptStatus("running", " Completed "));
        assertEquals(4, PhaseStateMachine.statusRank("cancelled"));
        assertEquals(0, PhaseStateMachine.statusRank("SOMETHING_ELSE"));
    }

    @Test
    void measurementIsAnAliasOfRunning() {
        assertEquals("RUNNING", PhaseStateMachine.normalizePhase("measurement"));
        assertEquals(PhaseStateMachine.phaseRank("RUNNING"), PhaseStateMachine.phaseRank("MEASUREMENT"));
        assertEquals(RunPhase.RUNNING, RunPhase.fromWire("MEASUREMENT"));
    }

    @Test
    void terminalPhaseRefusedWhileActive() {
        for (String status : new String[] {"RUNNING", "STOPPING", "CANCELLING"}) {
            assertFalse(PhaseStateMachine.acceptPhase("RUNNING", "COMPLETED", status), status);
        }
        assertTrue(PhaseStateMachine.acceptPhase("PROCESSING", "COMPLETED", "COMPLETED"));
    }

    @Test
    void terminalStatusTakesOnlyProcessingOrTerminalPhases() {
        assertTrue(PhaseStateMachine.acceptPhase("RUNNING", "PROCESSING", "CANCELLED"));
        assertTrue(PhaseStateMachine.acceptPhase("RUNNING", "COMPLETED", "FAILED"));
        assertFalse(PhaseStateMachine.acceptPhase("PREPARING", "WARMUP", "FAILED"));
    }

    @Test
    void phaseRankNeverDecreases() {
        assertTrue(PhaseStateMachine.acceptPhase("PREPARING", "WARMUP", "RUNNING"));
        assertTrue(PhaseStateMachine.acceptPhase("WARMUP", "RUNNING", "RUNNING"));
        assertTrue(PhaseStateMachine.acceptPhase("RUNNING", "RUNNING", "RUNNING"));
        assertFalse(PhaseStateMachine.acceptPhase("RUNNING", "WARMUP", "RUNNING"));
        assertFalse(PhaseStateMachine.acceptPhase("PROCESSING", "RUNNING", "STOPPING"));
    }

    @Test
    void unknownPhaseRefusedUnknownCurrentAcceptsAnything() {
        assertFalse(PhaseStateMachine.acceptPhase("RUNNING", "DANCING", "RUNNING"));
        assertTrue(PhaseStateMachine.acceptPhase("", "RUNNING", "RUNNING"));
        assertTrue(PhaseStateMachine.acceptPhase(null, "WARMUP", "STARTING"));
    }
}
