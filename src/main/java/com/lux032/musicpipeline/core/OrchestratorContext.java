package com.lux032.musicpipeline.core;

import com.lux032.musicpipeline.cache.ResultCache;
import com.lux032.musicpipeline.config.PipelineConfig;
import com.lux032.musicpipeline.lease.ExclusiveLease;
import com.lux032.musicpipeline.lease.FileExclusiveLease;
import com.lux032.musicpipeline.lease.InMemoryExclusiveLease;
import com.lux032.musicpipeline.lease.LeaseHandle;
import com.lux032.musicpipeline.model.ActionResult;
import com.lux032.musicpipeline.model.CommandResult;
import com.lux032.musicpipeline.model.InboxStats;
import com.lux032.musicpipeline.model.LibraryStats;
import com.lux032.musicpipeline.model.QueueName;
import com.lux032.musicpipeline.queue.DebouncePolicy;
import com.lux032.musicpipeline.queue.Debouncer;
import com.lux032.musicpipeline.queue.TargetResolvers;
import com.lux032.musicpipeline.queue.WorkQueue;
import com.lux032.musicpipeline.ratelimit.MarkerQuotaClassifier;
import com.lux032.musicpipeline.ratelimit.RetryLedger;
import com.lux032.musicpipeline.ratelimit.SlidingWindowRateLimiter;
import com.lux032.musicpipeline.service.AudioTagInspector;
import com.lux032.musicpipeline.service.BeetsCli;
import com.lux032.musicpipeline.service.CoverArtArchiveClient;
import com.lux032.musicpipeline.service.CoverFetchAction;
import com.lux032.musicpipeline.service.EventLog;
import com.lux032.musicpipeline.service.ExternalCommandRunner;
import com.lux032.musicpipeline.service.ImportAction;
import com.lux032.musicpipeline.service.InboxCleanupService;
import com.lux032.musicpipeline.service.InboxStatsService;
import com.lux032.musicpipeline.service.LibraryRegenAction;
import com.lux032.musicpipeline.service.LibraryStatsService;
import com.lux032.musicpipeline.service.LyricsFetchAction;
import com.lux032.musicpipeline.service.LyricsScanService;
import com.lux032.musicpipeline.service.SlskdClient;
import com.lux032.musicpipeline.util.FileSystemUtils;
import com.lux032.musicpipeline.worker.Worker;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 编排上下文
 * 进程内唯一的状态持有者: 队列、防抖器、租约、限流器、重试账本、缓存、事件日志和停止标志
 */
@Slf4j
@Getter
public class OrchestratorContext implements Closeable {

    private final PipelineConfig config;
    private final Clock clock;
    private final Path inboxRoot;
    private final Path libraryRoot;

    private final EventLog eventLog;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean stopping = new AtomicBoolean();
    @Getter(AccessLevel.NONE)
    private final Map<QueueName, Debouncer> debouncers = new EnumMap<>(QueueName.class);
    @Getter(AccessLevel.NONE)
    private final Set<QueueName> enabledQueues = EnumSet.noneOf(QueueName.class);

    private final ExclusiveLease importLease;
    private final SlidingWindowRateLimiter lyricsLimiter;
    private final RetryLedger lyricsLedger;

    private final FileSystemUtils fileSystemUtils;
    private final BeetsCli beets;
    private final CoverArtArchiveClient coverArtArchive;
    private final SlskdClient slskdClient;

    private final ResultCache<LibraryStats> libraryStatsCache;
    private final ResultCache<InboxStats> inboxStatsCache;

    private final ImportAction importAction;
    private final LibraryRegenAction regenAction;
    private final CoverFetchAction coverAction;
    private final LyricsFetchAction lyricsAction;
    private final InboxCleanupService inboxCleanupService;
    private final LyricsScanService lyricsScanService;

    // 手动导入可能持续数小时，扫描使用独立线程
    @Getter(AccessLevel.NONE)
    private final ExecutorService importExecutor;
    @Getter(AccessLevel.NONE)
    private final ExecutorService scanExecutor;

    public OrchestratorContext(PipelineConfig config,
                               Clock clock,
                               ExternalCommandRunner commandRunner,
                               AudioTagInspector tagInspector,
                               CoverArtArchiveClient coverArtArchive,
                               SlskdClient slskdClient) {
        this.config = config;
        this.clock = clock;
        this.inboxRoot = Paths.get(config.getInboxDirectory()).toAbsolutePath().normalize();
        this.libraryRoot = Paths.get(config.getLibraryDirectory()).toAbsolutePath().normalize();
        this.eventLog = new EventLog(config.getEventLogCapacity(), clock);
        this.fileSystemUtils = new FileSystemUtils(config);
        this.beets = new BeetsCli(config, commandRunner);
        this.coverArtArchive = coverArtArchive;
        this.slskdClient = slskdClient;

        // 队列与防抖器
        debouncers.put(QueueName.INBOX, new Debouncer(inboxRoot,
            WorkQueue.fifo(QueueName.INBOX, clock), DebouncePolicy.SETTLING,
            Duration.ofSeconds(config.getInboxDebounceSeconds()), config.getIgnoreSubstrings(),
            TargetResolvers.inboxTopLevel(), clock));
        debouncers.put(QueueName.LIBRARY, new Debouncer(libraryRoot,
            WorkQueue.fifo(QueueName.LIBRARY, clock), DebouncePolicy.FIXED_DELAY,
            Duration.ofSeconds(config.getLibraryDebounceSeconds()), config.getIgnoreSubstrings(),
            TargetResolvers.libraryKey(), clock));
        debouncers.put(QueueName.COVER, new Debouncer(libraryRoot,
            WorkQueue.fifo(QueueName.COVER, clock), DebouncePolicy.FIXED_DELAY,
            Duration.ofSeconds(config.getCoverDebounceSeconds()), config.getIgnoreSubstrings(),
            TargetResolvers.albumDirectory(config.getCoverFileName()), clock));
        debouncers.put(QueueName.LYRICS, new Debouncer(libraryRoot,
            WorkQueue.prioritized(QueueName.LYRICS, clock), DebouncePolicy.FIXED_DELAY,
            Duration.ofSeconds(config.getLyricsDebounceSeconds()), config.getIgnoreSubstrings(),
            TargetResolvers.audioFiles(config.getSupportedFormats()), clock));

        // 监控根目录不存在时，对应的 worker 不启动
        if (Files.isDirectory(inboxRoot)) {
            enabledQueues.add(QueueName.INBOX);
        } else {
            log.warn("✗ Inbox path does not exist: {}", inboxRoot);
        }
        if (Files.isDirectory(libraryRoot)) {
            enabledQueues.add(QueueName.LIBRARY);
            enabledQueues.add(QueueName.COVER);
            enabledQueues.add(QueueName.LYRICS);
        } else {
            log.warn("✗ Library path does not exist: {}", libraryRoot);
        }

        // 导入租约
        if ("memory".equalsIgnoreCase(config.getImportLockMode())) {
            this.importLease = new InMemoryExclusiveLease("import", clock);
        } else {
            this.importLease = new FileExclusiveLease(Paths.get(config.getImportLockFile()), clock);
        }

        // 歌词限流
        this.lyricsLimiter = new SlidingWindowRateLimiter(config.getLyricsRateLimit(),
            SlidingWindowRateLimiter.DEFAULT_WINDOW, Duration.ofSeconds(config.getLyricsCooldownSeconds()), clock);
        this.lyricsLedger = new RetryLedger(config.getLyricsMaxRetries());

        // 统计缓存
        LibraryStatsService libraryStatsService = new LibraryStatsService(beets, clock);
        InboxStatsService inboxStatsService = new InboxStatsService(inboxRoot, fileSystemUtils, clock);
        this.libraryStatsCache = new ResultCache<>("library-stats",
            Duration.ofSeconds(config.getLibraryStatsCacheSeconds()), libraryStatsService::compute, clock);
        this.inboxStatsCache = new ResultCache<>("inbox-stats",
            Duration.ofSeconds(config.getInboxStatsCacheSeconds()), inboxStatsService::compute, clock);

        // 领域动作
        this.importAction = new ImportAction(importLease, beets, fileSystemUtils, eventLog);
        this.regenAction = new LibraryRegenAction(commandRunner, config.getRegenCommand(),
            Duration.ofSeconds(config.getRegenTimeoutSeconds()), eventLog);
        this.coverAction = new CoverFetchAction(beets, coverArtArchive, tagInspector, fileSystemUtils, eventLog,
            config.getCoverFileName(), config.getCoverEmbeddedProbeLimit(),
            Duration.ofSeconds(config.getCoverTimeoutSeconds()));
        this.lyricsAction = new LyricsFetchAction(beets, lyricsLimiter, lyricsLedger,
            new MarkerQuotaClassifier(config.getLyricsQuotaMarkers()), tagInspector,
            debouncer(QueueName.LYRICS).getQueue(), eventLog, stopping::get,
            Duration.ofSeconds(config.getLyricsTimeoutSeconds()));

        this.inboxCleanupService = new InboxCleanupService(inboxRoot, fileSystemUtils, eventLog);
        this.lyricsScanService = new LyricsScanService(libraryRoot, fileSystemUtils, tagInspector,
            debouncer(QueueName.LYRICS), eventLog);

        this.importExecutor = daemonExecutor("manual-import");
        this.scanExecutor = daemonExecutor("lyrics-scan");
    }

    private static ExecutorService daemonExecutor(String threadName) {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 使用系统时钟和真实外部依赖创建上下文
     */
    public static OrchestratorContext create(PipelineConfig config) {
        return new OrchestratorContext(config,
            Clock.systemDefaultZone(),
            new ExternalCommandRunner(),
            new AudioTagInspector(),
            new CoverArtArchiveClient(config),
            new SlskdClient(config));
    }

    public Debouncer debouncer(QueueName name) {
        return debouncers.get(name);
    }

    public WorkQueue queue(QueueName name) {
        return debouncers.get(name).getQueue();
    }

    public boolean isEnabled(QueueName name) {
        return enabledQueues.contains(name);
    }

    public Set<QueueName> getEnabledQueues() {
        return Collections.unmodifiableSet(enabledQueues);
    }

    /**
     * 为队列创建 worker 并挂上成功后的处理
     */
    public Worker createWorker(QueueName name) {
        Debouncer debouncer = debouncer(name);
        switch (name) {
            case INBOX:
                return new Worker(debouncer, importAction, eventLog, stopping::get, clock)
                    .onSuccess(item -> afterImport());
            case LIBRARY:
                return new Worker(debouncer, regenAction, eventLog, stopping::get, clock)
                    .onSuccess(item -> libraryStatsCache.invalidate());
            case COVER:
                return new Worker(debouncer, coverAction, eventLog, stopping::get, clock)
                    .onSuccess(item -> enqueueLibraryRegen());
            case LYRICS:
                return new Worker(debouncer, lyricsAction, eventLog, stopping::get, clock);
            default:
                throw new IllegalArgumentException("unknown queue: " + name);
        }
    }

    public boolean enqueueLibraryRegen() {
        return debouncer(QueueName.LIBRARY).trigger(TargetResolvers.LIBRARY_TARGET);
    }

    void afterImport() {
        inboxStatsCache.invalidate();
        enqueueLibraryRegen();
    }

    /**
     * 手动导入整个收件箱
     * 租约被占用时立即返回 false；否则在后台持有租约执行导入
     */
    public boolean startManualImport() throws InterruptedException {
        Optional<LeaseHandle> handle = importLease.tryAcquire(Duration.ZERO);
        if (handle.isEmpty()) {
            eventLog.warning("Import already in progress - manual import rejected");
            return false;
        }
        eventLog.info("Manual import triggered");
        LeaseHandle lease = handle.get();
        try {
            importExecutor.submit(() -> {
                try (LeaseHandle ignored = lease) {
                    ActionResult result = importAction.importHeld(inboxRoot);
                    if (result.isSuccess()) {
                        afterImport();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    log.error("手动导入失败", e);
                    eventLog.error("Import exception: " + e.getMessage());
                }
            });
        } catch (RuntimeException e) {
            lease.release();
            throw e;
        }
        return true;
    }

    /**
     * 同步重建目录(手动刷新)
     */
    public CommandResult refreshLibrary() throws InterruptedException {
        eventLog.info("Manual library refresh triggered");
        CommandResult result = regenAction.regenerate();
        if (result.isSuccess()) {
            libraryStatsCache.invalidate();
        }
        return result;
    }

    /**
     * 手动请求获取封面
     * @return 路径不在音乐库内或不是目录时返回 false
     */
    public boolean requestCoverFetch(Path albumDirectory) {
        Path normalized = albumDirectory.toAbsolutePath().normalize();
        if (!normalized.startsWith(libraryRoot) || normalized.equals(libraryRoot) || !Files.isDirectory(normalized)) {
            return false;
        }
        debouncer(QueueName.COVER).trigger(normalized.toString());
        return true;
    }

    /**
     * 手动请求获取歌词
     * @return 路径不是音乐库内的音频文件时返回 false
     */
    public boolean requestLyricsFetch(Path track) {
        Optional<String> target = debouncer(QueueName.LYRICS).accept(track, false);
        if (target.isEmpty() || !Files.isRegularFile(Paths.get(target.get()))) {
            return false;
        }
        debouncer(QueueName.LYRICS).trigger(target.get());
        return true;
    }

    public void startLyricsScan() {
        scanExecutor.submit(() -> {
            try {
                lyricsScanService.scan();
            } catch (RuntimeException e) {
                log.error("歌词扫描失败", e);
                eventLog.error("Lyrics scan failed: " + e.getMessage());
            }
        });
    }

    public void requestStop() {
        stopping.set(true);
    }

    public boolean isStopping() {
        return stopping.get();
    }

    @Override
    public void close() {
        importExecutor.shutdown();
        scanExecutor.shutdown();
        try {
            if (!importExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("手动导入仍在运行");
            }
            if (!scanExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("歌词扫描仍在运行");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        closeQuietly(coverArtArchive);
        closeQuietly(slskdClient);
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.warn("关闭 HTTP 客户端失败: {}", e.getMessage());
        }
    }
}
