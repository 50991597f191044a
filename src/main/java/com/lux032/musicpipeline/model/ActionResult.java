package com.lux032.musicpipeline.model;

import lombok.Getter;
import lombok.ToString;

/**
 * 领域动作执行结果
 */
@Getter
@ToString
public final class ActionResult {

    public enum Status {

        /**
         * 执行成功，需要进行后续处理(缓存失效、链式入队)
         */
        SUCCEEDED,

        /**
         * 执行失败，由领域的重试策略决定是否重新入队
         */
        FAILED,

        /**
         * 未执行(租约被占用、目标已不存在、已有歌词等)，不算失败
         */
        SKIPPED
    }

    private final Status status;
    private final String detail;

    private ActionResult(Status status, String detail) {
        this.status = status;
        this.detail = detail;
    }

    public static ActionResult succeeded(String detail) {
        return new ActionResult(Status.SUCCEEDED, detail);
    }

    public static ActionResult failed(String detail) {
        return new ActionResult(Status.FAILED, detail);
    }

    public static ActionResult skipped(String detail) {
        return new ActionResult(Status.SKIPPED, detail);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}
