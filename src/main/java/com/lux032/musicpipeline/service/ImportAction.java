package com.lux032.musicpipeline.service;

import com.lux032.musicpipeline.lease.ExclusiveLease;
import com.lux032.musicpipeline.lease.LeaseHandle;
import com.lux032.musicpipeline.model.ActionResult;
import com.lux032.musicpipeline.model.CommandResult;
import com.lux032.musicpipeline.model.WorkItem;
import com.lux032.musicpipeline.util.FileSystemUtils;
import com.lux032.musicpipeline.worker.Action;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;

/**
 * 收件箱导入动作
 * 持有导入租约期间调用 beet import，同一时刻全局只允许一个导入
 */
@Slf4j
public class ImportAction implements Action {

    private final ExclusiveLease lease;
    private final BeetsCli beets;
    private final FileSystemUtils fileSystemUtils;
    private final EventLog eventLog;

    public ImportAction(ExclusiveLease lease, BeetsCli beets, FileSystemUtils fileSystemUtils, EventLog eventLog) {
        this.lease = lease;
        this.beets = beets;
        this.fileSystemUtils = fileSystemUtils;
        this.eventLog = eventLog;
    }

    @Override
    public String getName() {
        return "Inbox import";
    }

    @Override
    public ActionResult execute(WorkItem item) throws InterruptedException {
        Path target = Paths.get(item.getTarget());
        if (!Files.exists(target)) {
            log.info("导入目标已不存在，跳过: {}", target);
            return ActionResult.skipped("target missing");
        }
        if (!fileSystemUtils.hasAudioFiles(target)) {
            log.info("导入目标中没有音频文件，跳过: {}", target);
            return ActionResult.skipped("no audio");
        }

        Optional<LeaseHandle> handle = lease.tryAcquire(Duration.ZERO);
        if (handle.isEmpty()) {
            eventLog.warning("Import already in progress - skipping " + displayName(target));
            return ActionResult.skipped("lease held");
        }

        try (LeaseHandle ignored = handle.get()) {
            return importHeld(target);
        }
    }

    /**
     * 在已持有租约的前提下执行导入
     */
    public ActionResult importHeld(Path target) throws InterruptedException {
        eventLog.info("Starting import: " + displayName(target));
        CommandResult result = beets.importQuiet(target);
        if (result.isSuccess()) {
            eventLog.success("Import completed: " + displayName(target));
            return ActionResult.succeeded(displayName(target));
        }
        eventLog.error("Import failed: " + result.abbreviatedOutput(200));
        return ActionResult.failed(result.abbreviatedOutput(200));
    }

    public ExclusiveLease getLease() {
        return lease;
    }

    private static String displayName(Path target) {
        Path name = target.getFileName();
        return name == null ? target.toString() : name.toString();
    }
}
