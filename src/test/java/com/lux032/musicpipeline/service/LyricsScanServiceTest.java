package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.MutableClock;
import com.lux032.musicpipeline.model.QueueName;
import com.lux032.musicpipeline.model.WorkItem;
import com.lux032.musicpipeline.queue.DebouncePolicy;
import com.lux032.musicpipeline.queue.Debouncer;
import com.lux032.musicpipeline.queue.TargetResolvers;
import com.lux032.musicpipeline.queue.WorkQueue;
import com.lux032.musicpipeline.util.FileSystemUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LyricsScanServiceTest {

    @TempDir
    Path library;

    @Mock
    private AudioTagInspector tagInspector;

    @Test
    void shouldQueueTracksWithoutLyricsAtScanPriority() throws Exception {
        MutableClock clock = new MutableClock();
        String[] formats = {"flac", "mp3"};
        Debouncer debouncer = new Debouncer(library, WorkQueue.prioritized(QueueName.LYRICS, clock),
            DebouncePolicy.FIXED_DELAY, Duration.ZERO, List.of(), TargetResolvers.audioFiles(formats), clock);
        Path album = Files.createDirectories(library.resolve("Artist/Album"));
        Path withLyrics = Files.write(album.resolve("01.flac"), new byte[]{1});
        Path without = Files.write(album.resolve("02.flac"), new byte[]{1});
        Files.write(album.resolve("cover.jpg"), new byte[]{1});
        when(tagInspector.hasLyrics(withLyrics)).thenReturn(true);
        when(tagInspector.hasLyrics(without)).thenReturn(false);

        LyricsScanService service = new LyricsScanService(library, new FileSystemUtils(formats), tagInspector,
            debouncer, new EventLog(100, clock));

        Assertions.assertEquals(1, service.scan());
        WorkItem item = debouncer.getQueue().poll(1, TimeUnit.SECONDS);
        Assertions.assertEquals(without.toString(), item.getTarget());
        Assertions.assertEquals(LyricsScanService.SCAN_PRIORITY, item.getPriority());
    }
}
