package com.lux032.musicpipeline.ratelimit;

import com.lux032.musicpipeline.model.CommandResult;

import java.util.ArrayList;
import java.util.List;

/**
 * 通过输出文本中的标记识别配额耗尽
 * 外部工具没有结构化的状态码，只能匹配子串
 */
public class MarkerQuotaClassifier implements QuotaClassifier {

    private final List<String> markers;

    public MarkerQuotaClassifier(List<String> markers) {
        this.markers = new ArrayList<>(markers);
    }

    @Override
    public boolean isQuotaExceeded(CommandResult result) {
        if (result == null) {
            return false;
        }
        String output = result.getOutput();
        for (String marker : markers) {
            if (!marker.isEmpty() && output.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
