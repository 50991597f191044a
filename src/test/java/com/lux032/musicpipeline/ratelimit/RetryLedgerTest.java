package com.lux032.musicpipeline.ratelimit;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RetryLedgerTest {

    @Test
    void shouldReportExhaustionAtCeiling() {
        RetryLedger ledger = new RetryLedger(3);

        Assertions.assertEquals(1, ledger.recordFailure("/a.flac"));
        Assertions.assertEquals(2, ledger.recordFailure("/a.flac"));
        Assertions.assertFalse(ledger.isExhausted("/a.flac"));
        Assertions.assertEquals(3, ledger.recordFailure("/a.flac"));
        Assertions.assertTrue(ledger.isExhausted("/a.flac"));
        Assertions.assertEquals(1, ledger.exhaustedCount());
    }

    @Test
    void shouldForgetOnClear() {
        RetryLedger ledger = new RetryLedger(2);
        ledger.recordFailure("/a.flac");
        ledger.recordFailure("/a.flac");
        ledger.recordFailure("/b.flac");

        ledger.clear("/a.flac");
        Assertions.assertEquals(0, ledger.failureCount("/a.flac"));
        Assertions.assertEquals(1, ledger.trackedCount());

        ledger.clearAll();
        Assertions.assertEquals(0, ledger.trackedCount());
        Assertions.assertEquals(0, ledger.exhaustedCount());
    }

    @Test
    void shouldRejectNonPositiveCeiling() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RetryLedger(0));
    }
}
