package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.MutableClock;
import com.lux032.musicpipeline.model.CommandResult;
import com.lux032.musicpipeline.model.LibraryStats;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LibraryStatsServiceTest {

    @Mock
    private BeetsCli beets;

    @Test
    void shouldParseBeetStatsOutput() {
        LibraryStats stats = new LibraryStats();
        LibraryStatsService.parseBaseStats(String.join("\n",
            "Tracks: 1523",
            "Total time: 4.2 days",
            "Approximate total size: 48.7 GiB",
            "Artists: 201",
            "Albums: 140",
            "Album artists: 98"), stats);

        Assertions.assertEquals(1523, stats.getTracks());
        Assertions.assertEquals(140, stats.getAlbums());
        Assertions.assertEquals(98, stats.getAlbumArtists());
        Assertions.assertEquals("4.2 days", stats.getTotalTime());
        Assertions.assertEquals("48.7 GiB", stats.getTotalSize());
    }

    @Test
    void shouldRankByCountThenFirstSeen() {
        Map<String, Long> top = LibraryStatsService.topCounts(
            List.of("MP3", "FLAC", "AAC", "FLAC", "MP3", "OGG"), 3);

        Assertions.assertEquals(new ArrayList<>(List.of("MP3", "FLAC", "AAC")), new ArrayList<>(top.keySet()));
        Assertions.assertEquals(2L, top.get("MP3"));
        Assertions.assertEquals(1L, top.get("AAC"));
    }

    @Test
    void shouldSplitGenresAndSkipZeroYears() {
        LibraryStats stats = new LibraryStats();
        LibraryStatsService.parseGenresAndYears("Rock|1999\nJazz|0\n|2001\nRock|1999\n", stats);

        Assertions.assertEquals(2L, stats.getTopGenres().get("Rock"));
        Assertions.assertEquals(1L, stats.getTopGenres().get("Jazz"));
        Assertions.assertFalse(stats.getYears().containsKey("0"));
        Assertions.assertEquals(2, stats.getYears().size());
    }

    @Test
    void shouldKeepPartialResultsWhenOneQueryFails() throws Exception {
        when(beets.stats(any())).thenReturn(new CommandResult(0, "Tracks: 10\nAlbums: 2\n", false));
        when(beets.listTracks(eq("$format"), any())).thenReturn(new CommandResult(0, "FLAC\nFLAC\nMP3\n", false));
        when(beets.missing(any())).thenReturn(CommandResult.timeout(300, null));
        when(beets.listAlbums(eq("$genre|$year"), any())).thenReturn(new CommandResult(1, "", false));
        when(beets.listAlbums(eq("$label"), any())).thenReturn(new CommandResult(0, "Warp\nunknown\nWarp\n", false));

        LibraryStats stats = new LibraryStatsService(beets, new MutableClock()).compute();

        Assertions.assertEquals(10, stats.getTracks());
        Assertions.assertEquals(2L, stats.getFormats().get("FLAC"));
        Assertions.assertEquals(-1, stats.getMissingTracksCount());
        Assertions.assertEquals(Map.of("Warp", 2L), stats.getLabels());
        Assertions.assertNotNull(stats.getComputedAt());
    }
}
