package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.MutableClock;
import com.lux032.musicpipeline.model.EventLogEntry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

class EventLogTest {

    private final EventLog eventLog = new EventLog(5, new MutableClock());

    @Test
    void shouldAssignIncreasingIdsAndLevels() {
        EventLogEntry first = eventLog.info("Watching /music/inbox");
        EventLogEntry second = eventLog.error("Import failed: ArtistA");

        Assertions.assertEquals(1, first.getId());
        Assertions.assertEquals(2, second.getId());
        Assertions.assertEquals("info", first.getLevel());
        Assertions.assertEquals("error", second.getLevel());
        Assertions.assertEquals(2, eventLog.getLastId());
    }

    @Test
    void shouldEvictOldestBeyondCapacity() {
        for (int i = 1; i <= 8; i++) {
            eventLog.info("event " + i);
        }

        Assertions.assertEquals(5, eventLog.size());
        List<Long> ids = eventLog.tail(null, 50).stream().map(EventLogEntry::getId).collect(Collectors.toList());
        Assertions.assertEquals(List.of(4L, 5L, 6L, 7L, 8L), ids);
    }

    @Test
    void shouldReturnNewestEntriesInChronologicalOrder() {
        for (int i = 1; i <= 5; i++) {
            eventLog.info("event " + i);
        }

        List<Long> ids = eventLog.tail(null, 2).stream().map(EventLogEntry::getId).collect(Collectors.toList());
        Assertions.assertEquals(List.of(4L, 5L), ids);
    }

    @Test
    void shouldReturnEntriesAfterSinceId() {
        for (int i = 1; i <= 5; i++) {
            eventLog.info("event " + i);
        }

        List<Long> ids = eventLog.tail(2L, 2).stream().map(EventLogEntry::getId).collect(Collectors.toList());
        Assertions.assertEquals(List.of(3L, 4L), ids);
        Assertions.assertTrue(eventLog.tail(5L, 10).isEmpty());
        Assertions.assertTrue(eventLog.tail(null, 0).isEmpty());
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new EventLog(0, new MutableClock()));
    }
}
