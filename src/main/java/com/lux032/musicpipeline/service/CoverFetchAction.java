package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.model.ActionResult;
import com.lux032.musicpipeline.model.CommandResult;
import com.lux032.musicpipeline.model.WorkItem;
import com.lux032.musicpipeline.util.FileSystemUtils;
import com.lux032.musicpipeline.worker.Action;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 专辑封面获取动作
 * 降级顺序:
 * 1. 目录中已有的图片文件
 * 2. 音频文件内嵌封面
 * 3. 通过 beets 查出 release ID，从 Cover Art Archive 下载
 * 结果原子写入 cover.jpg
 */
@Slf4j
public class CoverFetchAction implements Action {

    // 优先级顺序
    private static final String[] COVER_NAMES = {"cover", "folder", "front", "album"};
    private static final String[] EXTENSIONS = {".jpg", ".jpeg", ".png", ".webp"};

    private final BeetsCli beets;
    private final CoverArtArchiveClient coverArtArchive;
    private final AudioTagInspector tagInspector;
    private final FileSystemUtils fileSystemUtils;
    private final EventLog eventLog;
    private final String coverFileName;
    private final int embeddedProbeLimit;
    private final Duration commandTimeout;

    public CoverFetchAction(BeetsCli beets,
                            CoverArtArchiveClient coverArtArchive,
                            AudioTagInspector tagInspector,
                            FileSystemUtils fileSystemUtils,
                            EventLog eventLog,
                            String coverFileName,
                            int embeddedProbeLimit,
                            Duration commandTimeout) {
        this.beets = beets;
        this.coverArtArchive = coverArtArchive;
        this.tagInspector = tagInspector;
        this.fileSystemUtils = fileSystemUtils;
        this.eventLog = eventLog;
        this.coverFileName = coverFileName;
        this.embeddedProbeLimit = embeddedProbeLimit;
        this.commandTimeout = commandTimeout;
    }

    @Override
    public String getName() {
        return "Cover fetch";
    }

    @Override
    public ActionResult execute(WorkItem item) throws IOException, InterruptedException {
        Path albumDir = Paths.get(item.getTarget());
        Path coverFile = albumDir.resolve(coverFileName);

        if (!Files.isDirectory(albumDir)) {
            return ActionResult.skipped("directory missing");
        }
        if (Files.exists(coverFile)) {
            return ActionResult.skipped("cover exists");
        }

        String albumName = String.valueOf(albumDir.getFileName());
        eventLog.info("Fetching cover art: " + albumName);

        Optional<byte[]> data = findLocalImage(albumDir);
        String source = "local image";
        if (data.isEmpty()) {
            data = findEmbeddedArtwork(albumDir);
            source = "embedded artwork";
        }
        if (data.isEmpty()) {
            data = fetchFromArchive(albumDir);
            source = "Cover Art Archive";
        }

        if (data.isEmpty()) {
            eventLog.warning("Cover fetch failed: " + albumName);
            return ActionResult.failed("no cover source");
        }

        FileSystemUtils.writeAtomically(coverFile, data.get());
        log.info("✓ 封面已写入: {} (来源: {})", coverFile, source);
        eventLog.success("Cover art fetched: " + albumName);
        return ActionResult.succeeded(source);
    }

    /**
     * 在目录中查找封面图片(文件名不区分大小写)
     */
    Optional<byte[]> findLocalImage(Path albumDir) {
        Map<String, Path> existing = new HashMap<>();
        try (Stream<Path> stream = Files.list(albumDir)) {
            stream.filter(Files::isRegularFile)
                .forEach(p -> existing.putIfAbsent(p.getFileName().toString().toLowerCase(Locale.ROOT), p));
        } catch (IOException e) {
            log.debug("列出目录失败: {} - {}", albumDir, e.getMessage());
            return Optional.empty();
        }

        for (String coverName : COVER_NAMES) {
            for (String ext : EXTENSIONS) {
                Path candidate = existing.get(coverName + ext);
                if (candidate == null) {
                    continue;
                }
                try {
                    byte[] imageData = Files.readAllBytes(candidate);
                    if (imageData.length > 0) {
                        log.info("找到封面文件: {}", candidate.getFileName());
                        return Optional.of(imageData);
                    }
                } catch (IOException e) {
                    log.debug("读取封面文件失败: {} - {}", candidate.getFileName(), e.getMessage());
                }
            }
        }
        return Optional.empty();
    }

    private Optional<byte[]> findEmbeddedArtwork(Path albumDir) {
        List<Path> audioFiles = fileSystemUtils.listAudioFiles(albumDir, embeddedProbeLimit);
        for (Path audioFile : audioFiles) {
            Optional<byte[]> artwork = tagInspector.embeddedArtwork(audioFile);
            if (artwork.isPresent()) {
                log.info("从音频文件提取到封面: {}", audioFile.getFileName());
                return artwork;
            }
        }
        return Optional.empty();
    }

    private Optional<byte[]> fetchFromArchive(Path albumDir) throws InterruptedException {
        CommandResult result = beets.albumIds(albumDir, commandTimeout);
        if (!result.isSuccess()) {
            log.debug("beets 查询 release ID 失败: {}", result.abbreviatedOutput(200));
            return Optional.empty();
        }
        for (String line : result.getOutput().split("\\R")) {
            String releaseId = line.trim();
            if (releaseId.isEmpty()) {
                continue;
            }
            Optional<byte[]> data = coverArtArchive.fetchFront(releaseId);
            if (data.isPresent()) {
                return data;
            }
        }
        return Optional.empty();
    }
}
