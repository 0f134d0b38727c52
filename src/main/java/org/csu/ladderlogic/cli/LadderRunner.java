package org.csu.ladderlogic.cli;

import org.csu.ladderlogic.common.exception.LadderFileException;
import org.csu.ladderlogic.config.LadderProperties;
import org.csu.ladderlogic.engine.CompilationResult;
import org.csu.ladderlogic.engine.LadderCompiler;
import org.csu.ladderlogic.engine.LineDiagnostic;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * @author hidyouth
 * @description: 命令行运行器: 解析参数, 读取输入文件, 生成梯形图并写入输出文件。
 * 退出码: 0 成功, 1 文件读写失败, 2 参数错误。
 */
@Component
public class LadderRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FILE_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private final LadderCompiler compiler;
    private final LadderFileService fileService;
    private final LadderProperties properties;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public LadderRunner(LadderCompiler compiler, LadderFileService fileService, LadderProperties properties) {
        this(compiler, fileService, properties, System.out, System.err);
    }

    LadderRunner(LadderCompiler compiler, LadderFileService fileService, LadderProperties properties,
                 PrintStream out, PrintStream err) {
        this.compiler = compiler;
        this.fileService = fileService;
        this.properties = properties;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        LadderArguments arguments;
        try {
            arguments = LadderArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(LadderArguments.USAGE);
            err.println("error: " + e.getMessage());
            exitCode = EXIT_USAGE;
            return;
        }

        try {
            List<String> lines = fileService.readLines(arguments.input());
            CompilationResult result = compiler.compile(lines, arguments.platform());
            if (properties.isReportSkippedLines()) {
                for (LineDiagnostic diagnostic : result.diagnostics()) {
                    err.println("Skipped line " + diagnostic.lineNumber() + ": " + diagnostic.reason());
                }
            }
            fileService.write(arguments.output(), result.text());
            out.println("Ladder logic generated for " + arguments.platform().getId()
                    + " and saved to " + arguments.output());
            exitCode = EXIT_OK;
        } catch (LadderFileException e) {
            err.println(e.getMessage());
            exitCode = EXIT_FILE_ERROR;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
