package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.model.ActionResult;
import com.lux032.musicpipeline.model.CommandResult;
import com.lux032.musicpipeline.model.WorkItem;
import com.lux032.musicpipeline.worker.Action;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * 重建音乐库目录(调用外部脚本)
 */
@Slf4j
public class LibraryRegenAction implements Action {

    private final ExternalCommandRunner runner;
    private final List<String> command;
    private final Duration timeout;
    private final EventLog eventLog;

    public LibraryRegenAction(ExternalCommandRunner runner, String commandLine, Duration timeout, EventLog eventLog) {
        this.runner = runner;
        this.command = ExternalCommandRunner.split(commandLine);
        this.timeout = timeout;
        this.eventLog = eventLog;
    }

    @Override
    public String getName() {
        return "Library regeneration";
    }

    @Override
    public ActionResult execute(WorkItem item) throws InterruptedException {
        CommandResult result = regenerate();
        return result.isSuccess()
            ? ActionResult.succeeded(result.abbreviatedOutput(200))
            : ActionResult.failed(result.abbreviatedOutput(200));
    }

    /**
     * 同步执行一次重建，手动刷新接口也走这里
     */
    public CommandResult regenerate() throws InterruptedException {
        eventLog.info("Starting library regeneration");
        CommandResult result = runner.run(command, timeout);
        if (result.isSuccess()) {
            eventLog.success("Library regeneration completed");
        } else {
            eventLog.error("Regeneration failed: " + result.abbreviatedOutput(200));
        }
        return result;
    }
}
