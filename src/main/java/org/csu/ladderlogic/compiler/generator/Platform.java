package org.csu.ladderlogic.compiler.generator;

import org.csu.ladderlogic.compiler.parser.ast.CounterNode;
import org.csu.ladderlogic.compiler.parser.ast.TimerNode;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * @author hidyouth
 * @description: 目标 PLC 平台及其定时器/计数器的书写格式。
 * 格式模板中的三个 %s 依次为: 类型, 名称, 参数。
 */
public enum Platform {
    SIEMENS("siemens", "%s %s Time: %s", "%s %s Count: %s"),
    ALLEN_BRADLEY("allen-bradley", "%s %s Preset: %s", "%s %s Preset: %s"),
    MITSUBISHI("mitsubishi", "%s %s K%s", "%s %s K%s"),
    OMRON("omron", "%s %s %s", "%s %s %s");

    private final String id;
    private final String timerFormat;
    private final String counterFormat;

    Platform(String id, String timerFormat, String counterFormat) {
        this.id = id;
        this.timerFormat = timerFormat;
        this.counterFormat = counterFormat;
    }

    public String getId() {
        return id;
    }

    public String formatTimer(TimerNode timer) {
        return String.format(timerFormat, timer.type(), timer.name(), timer.preset());
    }

    public String formatCounter(CounterNode counter) {
        return String.format(counterFormat, counter.type(), counter.name(), counter.preset());
    }

    /**
     * 名称必须与平台 id 完全一致(区分大小写)
     */
    public static boolean isKnown(String id) {
        return id != null && Arrays.stream(values()).anyMatch(p -> p.id.equals(id));
    }

    /**
     * 按名称查找平台, 未知名称(包括大小写不一致的名称)回退到 omron 的格式
     */
    public static Platform fromId(String id) {
        for (Platform platform : values()) {
            if (platform.id.equals(id)) {
                return platform;
            }
        }
        return OMRON;
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(Platform::getId).collect(Collectors.toList());
    }
}
