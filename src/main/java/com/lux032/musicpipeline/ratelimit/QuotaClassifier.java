package com.lux032.musicpipeline.ratelimit;

import com.lux032.musicpipeline.model.CommandResult;

/**
 * 判断外部调用结果是否表示配额耗尽
 */
@FunctionalInterface
public interface QuotaClassifier {

    boolean isQuotaExceeded(CommandResult result);
}
