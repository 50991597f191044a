package com.lux032.musicpipeline.config;

import lombok.Data;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * 流水线配置类
 * 从 pipeline.properties 加载，缺省项使用默认值
 */
@Data
public class PipelineConfig {

    public static final String DEFAULT_FILE_NAME = "pipeline.properties";

    // 监控目录配置
    private String inboxDirectory;
    private String libraryDirectory;
    private List<String> ignoreSubstrings;

    // 防抖窗口(秒)
    private int inboxDebounceSeconds;
    private int libraryDebounceSeconds;
    private int coverDebounceSeconds;
    private int lyricsDebounceSeconds;

    // beets 外部命令配置
    private String beetsCommand;
    private String beetsConfigPath;
    private String regenCommand;
    private int regenTimeoutSeconds;
    private int coverTimeoutSeconds;
    private int lyricsTimeoutSeconds;

    // 导入租约配置
    private String importLockFile;
    private String importLockMode; // file (默认) 或 memory

    // 歌词限流配置
    private int lyricsRateLimit;
    private int lyricsCooldownSeconds;
    private int lyricsMaxRetries;
    private List<String> lyricsQuotaMarkers;

    // 封面配置
    private String coverFileName;
    private String coverArtApiUrl;
    private String userAgent;
    private int coverEmbeddedProbeLimit;

    // 缓存配置
    private int libraryStatsCacheSeconds;
    private int inboxStatsCacheSeconds;

    // 事件日志
    private int eventLogCapacity;

    // Web 配置
    private int webPort;

    // 收件箱清理
    private int inboxCleanupIntervalMinutes;

    // slskd 配置
    private String slskdUrl;
    private String slskdApiKey;
    private int slskdSearchWaitSeconds;

    // HTTP 代理配置
    private boolean proxyEnabled;
    private String proxyHost;
    private int proxyPort;

    // 支持的音频格式
    private String[] supportedFormats;

    public PipelineConfig() {
        this.inboxDirectory = "/inbox";
        this.libraryDirectory = "/music/library";
        this.ignoreSubstrings = new ArrayList<>(Arrays.asList(".beets", "_UNPACK_"));

        this.inboxDebounceSeconds = 60;
        this.libraryDebounceSeconds = 30;
        this.coverDebounceSeconds = 30;
        this.lyricsDebounceSeconds = 10;

        this.beetsCommand = "beet";
        this.beetsConfigPath = "/config/config.yaml";
        this.regenCommand = "python3 /app/scripts/regenerate_albums.py";
        this.regenTimeoutSeconds = 1800;
        this.coverTimeoutSeconds = 300;
        this.lyricsTimeoutSeconds = 60;

        this.importLockFile = "/tmp/beets_import.lock";
        this.importLockMode = "file";

        this.lyricsRateLimit = 10;
        this.lyricsCooldownSeconds = 60;
        this.lyricsMaxRetries = 3;
        this.lyricsQuotaMarkers = new ArrayList<>(Arrays.asList("429", "Too Many Requests"));

        this.coverFileName = "cover.jpg";
        this.coverArtApiUrl = "https://coverartarchive.org";
        this.userAgent = "MusicPipeline/1.0 ( contact@example.com )";
        this.coverEmbeddedProbeLimit = 5;

        this.libraryStatsCacheSeconds = 300;
        this.inboxStatsCacheSeconds = 60;

        this.eventLogCapacity = 100;
        this.webPort = 8000;
        this.inboxCleanupIntervalMinutes = 30;

        this.slskdUrl = "http://localhost:5030";
        this.slskdApiKey = null;
        this.slskdSearchWaitSeconds = 3;

        this.supportedFormats = new String[]{"mp3", "flac", "m4a", "ogg", "wav", "aac", "opus"};
    }

    /**
     * 从指定文件加载配置，文件不存在时写出默认配置
     */
    public static PipelineConfig load(Path configPath) {
        PipelineConfig config = new PipelineConfig();
        config.loadFromFile(configPath);
        return config;
    }

    private void loadFromFile(Path configPath) {
        Properties props = new Properties();
        try (FileInputStream fis = new FileInputStream(configPath.toFile())) {
            props.load(fis);
            apply(props);
            System.out.println("Configuration file loaded successfully: " + configPath);
            if (proxyEnabled) {
                System.out.println("HTTP proxy enabled: " + proxyHost + ":" + proxyPort);
            }
        } catch (IOException e) {
            if (!Files.exists(configPath)) {
                System.out.println("Configuration file not found, generating default configuration");
                try {
                    saveToFile(configPath);
                    System.out.println("Default configuration saved to " + configPath);
                } catch (IOException ioException) {
                    System.err.println("Failed to create default configuration: " + ioException.getMessage());
                }
            } else {
                System.err.println("Failed to read configuration, using defaults: " + e.getMessage());
            }
        }
    }

    /**
     * 将属性覆盖到当前配置
     */
    void apply(Properties props) {
        if (props.containsKey("inbox.directory")) {
            this.inboxDirectory = props.getProperty("inbox.directory").trim();
        }
        if (props.containsKey("library.directory")) {
            this.libraryDirectory = props.getProperty("library.directory").trim();
        }
        if (props.containsKey("watch.ignoreSubstrings")) {
            this.ignoreSubstrings = splitList(props.getProperty("watch.ignoreSubstrings"));
        }

        this.inboxDebounceSeconds = intProperty(props, "debounce.inboxSeconds", inboxDebounceSeconds);
        this.libraryDebounceSeconds = intProperty(props, "debounce.librarySeconds", libraryDebounceSeconds);
        this.coverDebounceSeconds = intProperty(props, "debounce.coverSeconds", coverDebounceSeconds);
        this.lyricsDebounceSeconds = intProperty(props, "debounce.lyricsSeconds", lyricsDebounceSeconds);

        if (props.containsKey("beets.command")) {
            this.beetsCommand = props.getProperty("beets.command").trim();
        }
        if (props.containsKey("beets.config")) {
            this.beetsConfigPath = props.getProperty("beets.config").trim();
        }
        if (props.containsKey("regen.command")) {
            this.regenCommand = props.getProperty("regen.command").trim();
        }
        this.regenTimeoutSeconds = intProperty(props, "regen.timeoutSeconds", regenTimeoutSeconds);
        this.coverTimeoutSeconds = intProperty(props, "cover.timeoutSeconds", coverTimeoutSeconds);
        this.lyricsTimeoutSeconds = intProperty(props, "lyrics.timeoutSeconds", lyricsTimeoutSeconds);

        if (props.containsKey("import.lockFile")) {
            this.importLockFile = props.getProperty("import.lockFile").trim();
        }
        if (props.containsKey("import.lockMode")) {
            this.importLockMode = props.getProperty("import.lockMode").trim();
        }

        this.lyricsRateLimit = intProperty(props, "lyrics.rateLimit", lyricsRateLimit);
        this.lyricsCooldownSeconds = intProperty(props, "lyrics.cooldownSeconds", lyricsCooldownSeconds);
        this.lyricsMaxRetries = intProperty(props, "lyrics.maxRetries", lyricsMaxRetries);
        if (props.containsKey("lyrics.quotaMarkers")) {
            this.lyricsQuotaMarkers = splitList(props.getProperty("lyrics.quotaMarkers"));
        }

        if (props.containsKey("cover.fileName")) {
            this.coverFileName = props.getProperty("cover.fileName").trim();
        }
        if (props.containsKey("cover.apiUrl")) {
            this.coverArtApiUrl = props.getProperty("cover.apiUrl").trim();
        }
        if (props.containsKey("cover.userAgent")) {
            this.userAgent = props.getProperty("cover.userAgent").trim();
        }
        this.coverEmbeddedProbeLimit = intProperty(props, "cover.embeddedProbeLimit", coverEmbeddedProbeLimit);

        this.libraryStatsCacheSeconds = intProperty(props, "cache.libraryStatsSeconds", libraryStatsCacheSeconds);
        this.inboxStatsCacheSeconds = intProperty(props, "cache.inboxStatsSeconds", inboxStatsCacheSeconds);
        this.eventLogCapacity = intProperty(props, "eventLog.capacity", eventLogCapacity);
        this.webPort = intProperty(props, "web.port", webPort);
        this.inboxCleanupIntervalMinutes = intProperty(props, "cleanup.inboxIntervalMinutes", inboxCleanupIntervalMinutes);

        if (props.containsKey("slskd.url")) {
            this.slskdUrl = props.getProperty("slskd.url").trim();
        }
        if (props.containsKey("slskd.apiKey")) {
            this.slskdApiKey = props.getProperty("slskd.apiKey").trim();
        }
        this.slskdSearchWaitSeconds = intProperty(props, "slskd.searchWaitSeconds", slskdSearchWaitSeconds);

        if (props.containsKey("proxy.enabled")) {
            this.proxyEnabled = Boolean.parseBoolean(props.getProperty("proxy.enabled").trim());
        }
        if (props.containsKey("proxy.host")) {
            this.proxyHost = props.getProperty("proxy.host").trim();
        }
        this.proxyPort = intProperty(props, "proxy.port", proxyPort);

        if (props.containsKey("file.supportedFormats")) {
            List<String> formats = splitList(props.getProperty("file.supportedFormats"));
            if (!formats.isEmpty()) {
                this.supportedFormats = formats.toArray(new String[0]);
            }
        }
    }

    private static int intProperty(Properties props, String key, int fallback) {
        if (!props.containsKey(key)) {
            return fallback;
        }
        try {
            return Integer.parseInt(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + key + " configuration: " + props.getProperty(key));
            return fallback;
        }
    }

    private static List<String> splitList(String value) {
        if (value == null || value.trim().isEmpty()) {
            return new ArrayList<>();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }

    private void saveToFile(Path configPath) throws IOException {
        Properties props = new Properties();
        props.setProperty("inbox.directory", inboxDirectory);
        props.setProperty("library.directory", libraryDirectory);
        props.setProperty("watch.ignoreSubstrings", String.join(",", ignoreSubstrings));
        props.setProperty("debounce.inboxSeconds", String.valueOf(inboxDebounceSeconds));
        props.setProperty("debounce.librarySeconds", String.valueOf(libraryDebounceSeconds));
        props.setProperty("debounce.coverSeconds", String.valueOf(coverDebounceSeconds));
        props.setProperty("debounce.lyricsSeconds", String.valueOf(lyricsDebounceSeconds));
        props.setProperty("beets.command", beetsCommand);
        props.setProperty("beets.config", beetsConfigPath);
        props.setProperty("regen.command", regenCommand);
        props.setProperty("regen.timeoutSeconds", String.valueOf(regenTimeoutSeconds));
        props.setProperty("cover.timeoutSeconds", String.valueOf(coverTimeoutSeconds));
        props.setProperty("lyrics.timeoutSeconds", String.valueOf(lyricsTimeoutSeconds));
        props.setProperty("import.lockFile", importLockFile);
        props.setProperty("import.lockMode", importLockMode);
        props.setProperty("lyrics.rateLimit", String.valueOf(lyricsRateLimit));
        props.setProperty("lyrics.cooldownSeconds", String.valueOf(lyricsCooldownSeconds));
        props.setProperty("lyrics.maxRetries", String.valueOf(lyricsMaxRetries));
        props.setProperty("lyrics.quotaMarkers", String.join(",", lyricsQuotaMarkers));
        props.setProperty("cover.fileName", coverFileName);
        props.setProperty("cover.apiUrl", coverArtApiUrl);
        props.setProperty("cover.userAgent", userAgent);
        props.setProperty("cover.embeddedProbeLimit", String.valueOf(coverEmbeddedProbeLimit));
        props.setProperty("cache.libraryStatsSeconds", String.valueOf(libraryStatsCacheSeconds));
        props.setProperty("cache.inboxStatsSeconds", String.valueOf(inboxStatsCacheSeconds));
        props.setProperty("eventLog.capacity", String.valueOf(eventLogCapacity));
        props.setProperty("web.port", String.valueOf(webPort));
        props.setProperty("cleanup.inboxIntervalMinutes", String.valueOf(inboxCleanupIntervalMinutes));
        props.setProperty("slskd.url", slskdUrl);
        if (slskdApiKey != null) {
            props.setProperty("slskd.apiKey", slskdApiKey);
        }
        props.setProperty("slskd.searchWaitSeconds", String.valueOf(slskdSearchWaitSeconds));
        props.setProperty("proxy.enabled", String.valueOf(proxyEnabled));
        if (proxyHost != null) {
            props.setProperty("proxy.host", proxyHost);
        }
        props.setProperty("proxy.port", String.valueOf(proxyPort));
        props.setProperty("file.supportedFormats", String.join(",", supportedFormats));

        try (FileOutputStream fos = new FileOutputStream(configPath.toFile())) {
            props.store(fos, "Auto-generated by MusicPipeline");
        }
    }

    /**
     * 验证配置是否有效
     */
    public boolean isValid() {
        if (inboxDirectory == null || inboxDirectory.isEmpty()) {
            System.err.println("Inbox directory not configured");
            return false;
        }
        if (libraryDirectory == null || libraryDirectory.isEmpty()) {
            System.err.println("Library directory not configured");
            return false;
        }
        if (lyricsRateLimit <= 0) {
            System.err.println("lyrics.rateLimit must be positive");
            return false;
        }
        if (lyricsMaxRetries <= 0) {
            System.err.println("lyrics.maxRetries must be positive");
            return false;
        }
        if (slskdApiKey == null || slskdApiKey.isEmpty()) {
            System.err.println("WARNING: slskd API key not configured, download proxy requests will be rejected by slskd");
        }
        return true;
    }
}
