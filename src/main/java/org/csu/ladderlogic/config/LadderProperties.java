package org.csu.ladderlogic.config;

import lombok.Getter;
import lombok.Setter;
import org.csu.ladderlogic.compiler.generator.LadderGenerator;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @author hidyouth
 * @description: application.properties 中以 ladder. 开头的配置项
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ladder")
public class LadderProperties {

    /**
     * 嵌套在 AND/NOT 之下的 OR 是否展开为多条梯级; 为 false 时该行报错
     */
    private boolean expandNestedOr = true;

    /**
     * 一行条件最多展开出的梯级数
     */
    private int maxRungsPerLine = LadderGenerator.DEFAULT_MAX_RUNGS_PER_LINE;

    /**
     * 是否在 stderr 上报告被跳过的格式错误行
     */
    private boolean reportSkippedLines = true;

    /**
     * 读写文件使用的字符集
     */
    private String charset = "UTF-8";
}
