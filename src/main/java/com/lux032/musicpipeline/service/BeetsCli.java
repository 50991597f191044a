package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.config.PipelineConfig;
import com.lux032.musicpipeline.model.CommandResult;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * beets 命令行封装
 * 所有调用都带上 -c 指定的配置文件
 */
public class BeetsCli {

    private final ExternalCommandRunner runner;
    private final String command;
    private final String configPath;

    public BeetsCli(PipelineConfig config, ExternalCommandRunner runner) {
        this(runner, config.getBeetsCommand(), config.getBeetsConfigPath());
    }

    public BeetsCli(ExternalCommandRunner runner, String command, String configPath) {
        this.runner = runner;
        this.command = command;
        this.configPath = configPath;
    }

    /**
     * 静默导入目标目录，不设超时(大批量导入可能持续数小时)
     */
    public CommandResult importQuiet(Path target) throws InterruptedException {
        return runner.run(build("import", "-q", "-A", target.toString()), null);
    }

    public CommandResult fetchLyrics(Path track, Duration timeout) throws InterruptedException {
        return runner.run(build("lyrics", "-f", track.toString()), timeout);
    }

    /**
     * 查询目录对应专辑的 MusicBrainz release ID
     */
    public CommandResult albumIds(Path albumDirectory, Duration timeout) throws InterruptedException {
        return runner.run(build("list", "-a", "-f", "$mb_albumid", "path:" + albumDirectory), timeout);
    }

    public CommandResult stats(Duration timeout) throws InterruptedException {
        return runner.run(build("stats"), timeout);
    }

    public CommandResult listTracks(String format, Duration timeout) throws InterruptedException {
        return runner.run(build("list", "-f", format), timeout);
    }

    public CommandResult listAlbums(String format, Duration timeout) throws InterruptedException {
        return runner.run(build("list", "-a", "-f", format), timeout);
    }

    public CommandResult missing(Duration timeout) throws InterruptedException {
        return runner.run(build("missing"), timeout);
    }

    List<String> build(String... args) {
        List<String> parts = new ArrayList<>(ExternalCommandRunner.split(command));
        if (configPath != null && !configPath.isEmpty()) {
            parts.add("-c");
            parts.add(configPath);
        }
        for (String arg : args) {
            parts.add(arg);
        }
        return parts;
    }
}
