package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.model.CommandResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

class ExternalCommandRunnerTest {

    private final ExternalCommandRunner runner = new ExternalCommandRunner();

    @Test
    void shouldCaptureMergedOutputAndExitCode() throws Exception {
        CommandResult result = runner.run(List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"), Duration.ofSeconds(10));

        Assertions.assertEquals(3, result.getExitCode());
        Assertions.assertTrue(result.getOutput().contains("out"));
        Assertions.assertTrue(result.getOutput().contains("err"));
        Assertions.assertFalse(result.isSuccess());
    }

    @Test
    void shouldKillCommandAfterTimeout() throws Exception {
        CommandResult result = runner.run(List.of("sleep", "10"), Duration.ofMillis(200));

        Assertions.assertTrue(result.isTimedOut());
        Assertions.assertTrue(result.getOutput().startsWith("Timeout after"));
    }

    @Test
    void shouldReportMissingExecutable() throws Exception {
        CommandResult result = runner.run(List.of("definitely-not-a-real-command-xyz"), Duration.ofSeconds(1));

        Assertions.assertEquals(CommandResult.START_FAILED, result.getExitCode());
        Assertions.assertFalse(result.isTimedOut());
    }

    @Test
    void shouldSplitCommandLineOnWhitespace() {
        Assertions.assertEquals(List.of("python3", "/app/regen.py", "--all"),
            ExternalCommandRunner.split("  python3   /app/regen.py --all "));
    }
}
