package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.queue.Debouncer;
import com.lux032.musicpipeline.util.FileSystemUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 扫描整个音乐库，为没有内嵌歌词的音轨排入歌词队列(低优先级)
 */
@Slf4j
public class LyricsScanService {

    public static final int SCAN_PRIORITY = 2;

    private final Path libraryRoot;
    private final FileSystemUtils fileSystemUtils;
    private final AudioTagInspector tagInspector;
    private final Debouncer lyricsDebouncer;
    private final EventLog eventLog;

    public LyricsScanService(Path libraryRoot,
                             FileSystemUtils fileSystemUtils,
                             AudioTagInspector tagInspector,
                             Debouncer lyricsDebouncer,
                             EventLog eventLog) {
        this.libraryRoot = libraryRoot;
        this.fileSystemUtils = fileSystemUtils;
        this.tagInspector = tagInspector;
        this.lyricsDebouncer = lyricsDebouncer;
        this.eventLog = eventLog;
    }

    /**
     * @return 新入队的音轨数
     */
    public int scan() {
        eventLog.info("Starting library-wide lyrics scan");
        List<Path> tracks;
        try (Stream<Path> stream = Files.walk(libraryRoot)) {
            tracks = stream
                .filter(p -> Files.isRegularFile(p)
                    && !FileSystemUtils.isHidden(libraryRoot, p)
                    && fileSystemUtils.isAudioFile(p))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException | RuntimeException e) {
            log.error("Error scanning library for lyrics", e);
            eventLog.error("Lyrics scan failed: " + e.getMessage());
            return 0;
        }

        int count = 0;
        for (Path track : tracks) {
            if (tagInspector.hasLyrics(track)) {
                continue;
            }
            if (lyricsDebouncer.trigger(track.toString(), SCAN_PRIORITY)) {
                count++;
            }
        }
        eventLog.success("Lyrics scan complete: " + count + " tracks queued");
        return count;
    }
}
