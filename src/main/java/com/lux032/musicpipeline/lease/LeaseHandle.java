package com.lux032.musicpipeline.lease;

import com.lux032.musicpipeline.model.LeaseRecord;

/**
 * 已获取的租约，release() 可重复调用
 */
public interface LeaseHandle extends AutoCloseable {

    void release();

    LeaseRecord getRecord();

    @Override
    default void close() {
        release();
    }
}
