package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.util.FileSystemUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 收件箱清理
 * 删除不含音频的顶层目录树，其余目录只删除空子目录
 */
@Slf4j
public class InboxCleanupService {

    private final Path inboxRoot;
    private final FileSystemUtils fileSystemUtils;
    private final EventLog eventLog;

    public InboxCleanupService(Path inboxRoot, FileSystemUtils fileSystemUtils, EventLog eventLog) {
        this.inboxRoot = inboxRoot;
        this.fileSystemUtils = fileSystemUtils;
        this.eventLog = eventLog;
    }

    /**
     * @return 删除的目录数
     */
    public int cleanup() {
        if (!Files.isDirectory(inboxRoot)) {
            return 0;
        }

        List<Path> children;
        try (Stream<Path> stream = Files.list(inboxRoot)) {
            children = stream.sorted().collect(Collectors.toList());
        } catch (IOException e) {
            log.error("[CLEANUP] 列出收件箱失败: {}", e.getMessage());
            return 0;
        }

        int removed = 0;
        for (Path child : children) {
            String name = child.getFileName().toString();
            if (!Files.isDirectory(child) || name.startsWith(".")) {
                continue;
            }
            // 解压中的目录
            if (name.toLowerCase(Locale.ROOT).contains("unpack")) {
                continue;
            }

            if (!fileSystemUtils.hasAudioFiles(child)) {
                try {
                    deleteTree(child);
                    eventLog.warning("Removing directory tree with no audio: " + name);
                    removed++;
                } catch (IOException e) {
                    log.error("[CLEANUP] Failed to remove {}: {}", child, e.getMessage());
                }
            } else {
                removed += removeEmptyDirectories(child);
            }
        }
        return removed;
    }

    /**
     * 自底向上删除空目录(包括 directory 自身)
     */
    private int removeEmptyDirectories(Path directory) {
        List<Path> directories = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(directory)) {
            stream.filter(Files::isDirectory).forEach(directories::add);
        } catch (IOException e) {
            log.debug("[CLEANUP] 遍历失败: {} - {}", directory, e.getMessage());
            return 0;
        }
        directories.sort(Comparator.comparingInt(Path::getNameCount).reversed());

        int removed = 0;
        for (Path dir : directories) {
            try (Stream<Path> entries = Files.list(dir)) {
                if (entries.findAny().isPresent()) {
                    continue;
                }
            } catch (IOException e) {
                log.debug("[CLEANUP] Could not read {}: {}", dir, e.getMessage());
                continue;
            }
            try {
                Files.delete(dir);
                eventLog.info("Removing empty dir: " + dir.getFileName());
                removed++;
            } catch (IOException e) {
                log.debug("[CLEANUP] Could not remove {}: {}", dir, e.getMessage());
            }
        }
        return removed;
    }

    private static void deleteTree(Path root) throws IOException {
        List<Path> paths;
        try (Stream<Path> stream = Files.walk(root)) {
            paths = stream.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }
}
