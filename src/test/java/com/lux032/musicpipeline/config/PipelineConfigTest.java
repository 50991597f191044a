package com.lux032.musicpipeline.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

class PipelineConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldOverrideDefaultsFromProperties() {
        Properties props = new Properties();
        props.setProperty("inbox.directory", " /data/inbox ");
        props.setProperty("debounce.inboxSeconds", "120");
        props.setProperty("lyrics.rateLimit", "5");
        props.setProperty("lyrics.quotaMarkers", "429, quota exceeded ,");
        props.setProperty("import.lockMode", "memory");
        props.setProperty("file.supportedFormats", "flac,mp3");

        PipelineConfig config = new PipelineConfig();
        config.apply(props);

        Assertions.assertEquals("/data/inbox", config.getInboxDirectory());
        Assertions.assertEquals(120, config.getInboxDebounceSeconds());
        Assertions.assertEquals(5, config.getLyricsRateLimit());
        Assertions.assertEquals(List.of("429", "quota exceeded"), config.getLyricsQuotaMarkers());
        Assertions.assertEquals("memory", config.getImportLockMode());
        Assertions.assertArrayEquals(new String[]{"flac", "mp3"}, config.getSupportedFormats());
        // 未配置的项保持默认值
        Assertions.assertEquals("/music/library", config.getLibraryDirectory());
        Assertions.assertEquals(30, config.getLibraryDebounceSeconds());
    }

    @Test
    void shouldKeepDefaultForMalformedNumber() {
        Properties props = new Properties();
        props.setProperty("web.port", "eighty");

        PipelineConfig config = new PipelineConfig();
        config.apply(props);

        Assertions.assertEquals(8000, config.getWebPort());
    }

    @Test
    void shouldWriteDefaultFileWhenMissing() throws Exception {
        Path configFile = tempDir.resolve("pipeline.properties");

        PipelineConfig config = PipelineConfig.load(configFile);

        Assertions.assertTrue(Files.exists(configFile));
        Assertions.assertEquals("cover.jpg", config.getCoverFileName());
        PipelineConfig reloaded = PipelineConfig.load(configFile);
        Assertions.assertEquals(config.getLyricsCooldownSeconds(), reloaded.getLyricsCooldownSeconds());
    }

    @Test
    void shouldRejectNonPositiveRateLimit() {
        PipelineConfig config = new PipelineConfig();
        config.setLyricsRateLimit(0);

        Assertions.assertFalse(config.isValid());
    }
}
