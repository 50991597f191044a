package com.lux032.musicpipeline.worker;

import com.lux032.musicpipeline.model.ActionResult;
import com.lux032.musicpipeline.model.WorkItem;

import java.io.IOException;

/**
 * 队列所触发的领域动作(导入、重建目录、获取封面、获取歌词)
 */
public interface Action {

    String getName();

    ActionResult execute(WorkItem item) throws IOException, InterruptedException;
}
