package stratus.engine.monitor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkerTokenizerTest {

    @Test
    void phasesFollowMilestones() {
        MarkerTokenizer tokenizer = new MarkerTokenizer();
        assertEquals(MarkerTokenizer.Phase.AWAITING_START, tokenizer.phase());

        tokenizer.feed("[START] Creating virtual network");
        assertEquals(MarkerTokenizer.Phase.RUNNING, tokenizer.phase());
        assertTrue(tokenizer.started());

        tokenizer.feed("[PROGRESS] Step 1/2: address space");
        tokenizer.feed("[VALIDATE] Checking subnet");
        assertEquals(MarkerTokenizer.Phase.VALIDATING, tokenizer.phase());

        tokenizer.feed("[SUCCESS] VNet ready");
        assertEquals(MarkerTokenizer.Phase.SUCCEEDED, tokenizer.phase());
        assertTrue(tokenizer.successSeen());
        assertEquals("Step 1/2: address space", tokenizer.lastProgress().orElseThrow());
        assertEquals(4, tokenizer.lines());
    }

    @Test
    void progressBeforeStartCountsAsRunning() {
        MarkerTokenizer tokenizer = new MarkerTokenizer();
        tokenizer.feed("[PROGRESS] already going");

        assertEquals(MarkerTokenizer.Phase.RUNNING, tokenizer.phase());
        assertFalse(tokenizer.started());
    }

    @Test
    void phasesNeverMoveBackwards() {
        MarkerTokenizer tokenizer = new MarkerTokenizer();
        tokenizer.feed("[VALIDATE] checking");
        tokenizer.feed("[PROGRESS] late progress line");

        assertEquals(MarkerTokenizer.Phase.VALIDATING, tokenizer.phase());
    }

    @Test
    void errorIsSticky() {
        MarkerTokenizer tokenizer = new MarkerTokenizer();
        tokenizer.feed("[START]");
        tokenizer.feed("[ERROR] Subnet overlaps existing range");
        tokenizer.feed("[SUCCESS] done anyway");

        assertEquals(MarkerTokenizer.Phase.FAILED, tokenizer.phase());
        assertTrue(tokenizer.errorSeen());
        assertTrue(tokenizer.successSeen());
        assertEquals(List.of("Subnet overlaps existing range"), tokenizer.errors());
    }

    @Test
    void markersAreFoundMidLine() {
        MarkerTokenizer tokenizer = new MarkerTokenizer();

        assertTrue(tokenizer.feed("2026-01-01 10:00:00 [WARNING] Disk nearly full").isPresent());
        assertTrue(tokenizer.feed("plain output line").isEmpty());
        assertTrue(tokenizer.feed("[progress] lower case is not a marker").isEmpty());
        tokenizer.feed("[MONITOR] heartbeat file refreshed");

        assertEquals(List.of("Disk nearly full"), tokenizer.warnings());
        assertEquals(1, tokenizer.count(ProgressMarker.MONITOR));
        assertEquals(0, tokenizer.count(ProgressMarker.SUCCESS));
        assertEquals(MarkerTokenizer.Phase.AWAITING_START, tokenizer.phase());
    }

    @Test
    void findReturnsFirstMarker() {
        ProgressMarker.Match match = ProgressMarker.find("[PROGRESS] copying [SUCCESS] logs").orElseThrow();

        assertEquals(ProgressMarker.PROGRESS, match.marker());
        assertEquals("copying [SUCCESS] logs", match.message());
        assertEquals("[ERROR]", ProgressMarker.ERROR.token());
        assertTrue(ProgressMarker.find(null).isEmpty());
    }
}
