package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.model.CommandResult;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 外部命令执行器
 * 合并标准输出和错误输出；timeout 为空时一直等待到命令结束
 */
@Slf4j
public class ExternalCommandRunner {

    public CommandResult run(List<String> command, Duration timeout) throws InterruptedException {
        log.debug("执行外部命令: {}", String.join(" ", command));

        Process process;
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.redirectErrorStream(true);
            process = processBuilder.start();
        } catch (IOException e) {
            log.error("启动外部命令失败: {} - {}", command.get(0), e.getMessage());
            return CommandResult.startFailed(e.getMessage());
        }

        StringBuffer output = new StringBuffer();
        Thread reader = new Thread(() -> drain(process, output), "command-output-" + process.pid());
        reader.setDaemon(true);
        reader.start();

        try {
            if (timeout == null) {
                process.waitFor();
            } else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                reader.join(1000);
                log.error("Command timed out after {}s: {}", timeout.getSeconds(), command);
                return CommandResult.timeout(timeout.getSeconds(), output.toString());
            }
            reader.join();
            return new CommandResult(process.exitValue(), output.toString(), false);
        } catch (InterruptedException e) {
            process.destroy();
            throw e;
        }
    }

    private static void drain(Process process, StringBuffer output) {
        try (BufferedReader br = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                output.append(line).append('\n');
            }
        } catch (IOException e) {
            log.debug("读取命令输出中断: {}", e.getMessage());
        }
    }

    /**
     * 按空白拆分配置中的命令行
     */
    public static List<String> split(String commandLine) {
        List<String> parts = new ArrayList<>();
        for (String part : commandLine.trim().split("\\s+")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts;
    }
}
