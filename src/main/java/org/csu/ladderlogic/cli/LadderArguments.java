package org.csu.ladderlogic.cli;

import org.csu.ladderlogic.compiler.generator.Platform;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 命令行参数: 输入文件、目标平台、输出文件, 三者都必须提供。
 * 支持 "--input a.txt", "-i a.txt" 和 "--input=a.txt" 三种写法;
 * 以 --spring. 或 --ladder. 开头的参数是配置覆盖项, 这里忽略。
 */
public record LadderArguments(Path input, Platform platform, Path output) {

    public static final String USAGE =
            "Usage: ladderlogic --input <file> --platform <" + String.join("|", Platform.ids()) + "> --output <file>";

    private static final Map<String, String> OPTION_NAMES = Map.of(
            "--input", "input", "-i", "input",
            "--platform", "platform", "-p", "platform",
            "--output", "output", "-o", "output"
    );

    /**
     * @throws IllegalArgumentException 缺少参数、未知参数或未知平台
     */
    public static LadderArguments parse(String... args) {
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--spring.") || arg.startsWith("--ladder.")) {
                continue;
            }
            String name = arg;
            String value = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            }
            String key = OPTION_NAMES.get(name);
            if (key == null) {
                throw new IllegalArgumentException("unrecognized argument: " + arg);
            }
            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("argument " + name + ": expected one argument");
                }
                value = args[++i];
            }
            values.put(key, value);
        }

        for (String required : new String[]{"input", "platform", "output"}) {
            if (!values.containsKey(required)) {
                throw new IllegalArgumentException("the following argument is required: --" + required);
            }
        }
        String platformId = values.get("platform");
        if (!Platform.isKnown(platformId)) {
            throw new IllegalArgumentException("argument --platform: invalid choice: '" + platformId
                    + "' (choose from " + String.join(", ", Platform.ids()) + ")");
        }
        return new LadderArguments(Path.of(values.get("input")), Platform.fromId(platformId), Path.of(values.get("output")));
    }
}
