package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.model.QueueName;
import com.lux032.musicpipeline.queue.DebouncePolicy;
import com.lux032.musicpipeline.queue.Debouncer;
import com.lux032.musicpipeline.queue.TargetResolvers;
import com.lux032.musicpipeline.queue.WorkQueue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

class DirectoryWatcherTest {

    @TempDir
    Path root;

    @Test
    void shouldRefuseToStartWithoutRoot() throws Exception {
        DirectoryWatcher watcher = new DirectoryWatcher(root.resolve("missing"));

        Assertions.assertFalse(watcher.start());
        Assertions.assertFalse(watcher.isRunning());
    }

    @Test
    void shouldReportFilesInsideNewlyCreatedDirectories() throws Exception {
        Path expected = root.resolve("Artist/Album/01.flac");
        CountDownLatch seen = new CountDownLatch(1);
        DirectoryWatcher watcher = new DirectoryWatcher(root).addListener((path, directory) -> {
            if (!directory && path.equals(expected)) {
                seen.countDown();
            }
        });

        Assertions.assertTrue(watcher.start());
        try {
            Files.createDirectories(expected.getParent());
            Files.write(expected, new byte[]{1});

            Assertions.assertTrue(seen.await(10, TimeUnit.SECONDS));
        } finally {
            watcher.stop();
        }
        Assertions.assertFalse(watcher.isRunning());
    }

    @Test
    void shouldKeepDispatchingWhenListenerThrows() {
        List<Path> received = new ArrayList<>();
        DirectoryWatcher watcher = new DirectoryWatcher(root)
            .addListener((path, directory) -> {
                throw new IllegalStateException("broken listener");
            })
            .addListener((path, directory) -> received.add(path));

        watcher.dispatch(root.resolve("x.flac"), false);

        Assertions.assertEquals(List.of(root.resolve("x.flac")), received);
    }

    @Test
    void shouldNotQueueLibraryRegenWhenExistingTrackIsRewritten() throws Exception {
        Path track = root.resolve("A/B/01.flac");
        Files.createDirectories(track.getParent());
        Files.write(track, new byte[]{1, 2, 3});
        Clock clock = Clock.systemUTC();
        Debouncer library = new Debouncer(root, WorkQueue.fifo(QueueName.LIBRARY, clock),
            DebouncePolicy.FIXED_DELAY, Duration.ZERO, List.of(), TargetResolvers.libraryKey(), clock);
        DirectoryWatcher watcher = new DirectoryWatcher(root).addListener(library::observe);

        Assertions.assertTrue(watcher.start());
        try {
            Files.write(track, new byte[]{4, 5, 6}, StandardOpenOption.APPEND);
            Thread.sleep(3000);

            Assertions.assertEquals(0, library.getQueue().depth());
        } finally {
            watcher.stop();
        }
    }

    @Test
    void shouldDeliverModificationsWhenEnabled() throws Exception {
        Path track = root.resolve("Artist/01.flac");
        Files.createDirectories(track.getParent());
        Files.write(track, new byte[]{1});
        CountDownLatch modified = new CountDownLatch(1);
        DirectoryWatcher watcher = new DirectoryWatcher(root).withModifications().addListener((path, directory) -> {
            if (path.equals(track)) {
                modified.countDown();
            }
        });

        Assertions.assertTrue(watcher.isDeliveringModifications());
        Assertions.assertTrue(watcher.start());
        try {
            Files.write(track, new byte[]{2}, StandardOpenOption.APPEND);

            Assertions.assertTrue(modified.await(10, TimeUnit.SECONDS));
        } finally {
            watcher.stop();
        }
    }
}
