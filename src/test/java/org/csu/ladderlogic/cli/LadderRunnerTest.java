package org.csu.ladderlogic.cli;

import org.csu.ladderlogic.common.exception.LadderFileException;
import org.csu.ladderlogic.config.LadderProperties;
import org.csu.ladderlogic.engine.LadderCompiler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author hidyouth
 * @description: LadderRunner 的测试: 真实文件读写, 以及用 Mock 模拟写文件失败
 */
public class LadderRunnerTest {

    @TempDir
    Path tempDir;

    private LadderProperties properties;
    private LadderCompiler compiler;
    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;

    @BeforeEach
    void setUp() {
        properties = new LadderProperties();
        compiler = new LadderCompiler(properties);
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
    }

    private LadderRunner runner(LadderFileService fileService) {
        return new LadderRunner(compiler, fileService, properties,
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testGeneratesOutputFile() throws IOException {
        System.out.println("--- Running test: testGeneratesOutputFile ---");
        Path input = tempDir.resolve("logic.txt");
        Path output = tempDir.resolve("out/ladder.txt");
        Files.writeString(input, "IF Start AND NOT Stop THEN Motor\nIF (Broken THEN X\n");

        LadderRunner runner = runner(new LadderFileService(properties));
        runner.run("--input", input.toString(), "--platform", "allen-bradley", "--output", output.toString());

        assertEquals(0, runner.getExitCode());
        assertEquals("// Rung\n|----[ ] Start----[/] [ ] Stop----( )----|\n     Motor\n\n", Files.readString(output));
        assertTrue(stdout.toString(StandardCharsets.UTF_8).contains("Ladder logic generated for allen-bradley"));
        assertTrue(err().contains("Skipped line 2:"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSkippedLinesCanBeSilenced() throws IOException {
        System.out.println("--- Running test: testSkippedLinesCanBeSilenced ---");
        properties.setReportSkippedLines(false);
        Path input = tempDir.resolve("logic.txt");
        Files.writeString(input, "IF (Broken THEN X\n");

        LadderRunner runner = runner(new LadderFileService(properties));
        runner.run("-i", input.toString(), "-p", "omron", "-o", tempDir.resolve("ladder.txt").toString());

        assertEquals(0, runner.getExitCode());
        assertEquals("", err());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMissingInputFileExitsWithOne() {
        System.out.println("--- Running test: testMissingInputFileExitsWithOne ---");
        LadderRunner runner = runner(new LadderFileService(properties));
        runner.run("-i", tempDir.resolve("missing.txt").toString(), "-p", "siemens", "-o", tempDir.resolve("o.txt").toString());

        assertEquals(1, runner.getExitCode());
        assertTrue(err().contains("Error reading input file"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testWriteFailureExitsWithOne() {
        System.out.println("--- Running test: testWriteFailureExitsWithOne ---");
        LadderFileService fileService = Mockito.mock(LadderFileService.class);
        Path output = Path.of("ladder.txt");
        when(fileService.readLines(any(Path.class))).thenReturn(List.of("IF A THEN B"));
        doThrow(new LadderFileException("Error writing output file", output, new IOException("disk full")))
                .when(fileService).write(any(Path.class), anyString());

        LadderRunner runner = runner(fileService);
        runner.run("-i", "logic.txt", "-p", "siemens", "-o", output.toString());

        assertEquals(1, runner.getExitCode());
        assertTrue(err().contains("Error writing output file"));
        assertTrue(err().contains("disk full"));
        assertTrue(err().contains("Error writing output file: ladder.txt"));
        assertEquals("", stdout.toString(StandardCharsets.UTF_8));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testBadArgumentsExitWithTwo() {
        System.out.println("--- Running test: testBadArgumentsExitWithTwo ---");
        LadderFileService fileService = Mockito.mock(LadderFileService.class);
        LadderRunner runner = runner(fileService);
        runner.run("-i", "logic.txt", "-p", "beckhoff", "-o", "out.txt");

        assertEquals(2, runner.getExitCode());
        assertTrue(err().startsWith("Usage:"));
        verify(fileService, never()).readLines(any(Path.class));
        System.out.println("Result: Test PASSED.\n");
    }
}
