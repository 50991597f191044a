package com.lux032.musicpipeline.lease;

import java.time.Duration;
import java.util.Optional;

/**
 * 具名的独占租约
 * 保证系统范围内同一时刻至多一个持有者；持有进程退出时由底层机制自动释放
 */
public interface ExclusiveLease {

    /**
     * 尝试获取租约
     * @param timeout 为 0 时立即返回，否则轮询直到超时
     * @return 获取成功时返回租约句柄
     */
    Optional<LeaseHandle> tryAcquire(Duration timeout) throws InterruptedException;

    /**
     * 当前进程是否持有租约
     */
    boolean isHeld();

    /**
     * 租约名称(诊断用)
     */
    String getName();
}
