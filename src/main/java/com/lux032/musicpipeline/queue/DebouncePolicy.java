package com.lux032.musicpipeline.queue;

/**
 * 防抖策略，每个队列固定选择一种
 */
public enum DebouncePolicy {

    /**
     * 首次通知立即入队，worker 出队后固定等待一个窗口，期间的通知被去重守卫吸收且不延长等待
     */
    FIXED_DELAY,

    /**
     * worker 等待到 target 连续一个窗口没有新通知为止，每次通知都会重置截止时间
     */
    SETTLING
}
