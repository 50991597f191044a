package com.lux032.musicpipeline.model;

import lombok.Getter;
import lombok.ToString;

/**
 * 外部命令执行结果(标准输出与错误输出已合并)
 */
@Getter
@ToString
public final class CommandResult {

    public static final int START_FAILED = -1;

    private final int exitCode;
    private final String output;
    private final boolean timedOut;

    public CommandResult(int exitCode, String output, boolean timedOut) {
        this.exitCode = exitCode;
        this.output = output == null ? "" : output;
        this.timedOut = timedOut;
    }

    public static CommandResult startFailed(String message) {
        return new CommandResult(START_FAILED, message, false);
    }

    public static CommandResult timeout(long seconds, String partialOutput) {
        String output = "Timeout after " + seconds + "s";
        if (partialOutput != null && !partialOutput.isEmpty()) {
            output = output + "\n" + partialOutput;
        }
        return new CommandResult(START_FAILED, output, true);
    }

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }

    /**
     * 截取输出前 N 个字符，用于事件日志
     */
    public String abbreviatedOutput(int maxLength) {
        if (output.isEmpty()) {
            return "No output";
        }
        String trimmed = output.trim();
        return trimmed.length() <= maxLength ? trimmed : trimmed.substring(0, maxLength);
    }
}
