package com.lux032.musicpipeline.model;

import lombok.Data;

import java.time.Instant;

/**
 * 租约诊断记录，仅用于排查，正确性由底层文件锁保证
 */
@Data
public class LeaseRecord {
    private final long holderPid;
    private final Instant acquiredAt;

    public String toFileContent() {
        return holderPid + "\n" + acquiredAt + "\n";
    }
}
