package org.csu.ladderlogic.compiler;

import org.csu.ladderlogic.common.exception.LadderGenerationException;
import org.csu.ladderlogic.compiler.generator.ContactRenderer;
import org.csu.ladderlogic.compiler.generator.LadderGenerator;
import org.csu.ladderlogic.compiler.generator.Platform;
import org.csu.ladderlogic.compiler.parser.LogicLineParser;
import org.csu.ladderlogic.compiler.parser.ParsedLine;
import org.csu.ladderlogic.compiler.parser.ast.BlockType;
import org.csu.ladderlogic.compiler.parser.ast.CounterNode;
import org.csu.ladderlogic.compiler.parser.ast.OrNode;
import org.csu.ladderlogic.compiler.parser.ast.TimerNode;
import org.csu.ladderlogic.compiler.parser.ast.VariableNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: LadderGenerator 的单元测试: 梯级格式、OR 拆分以及各平台的定时器/计数器格式
 */
public class LadderGeneratorTest {

    private final LogicLineParser lineParser = new LogicLineParser();

    private String generate(LadderGenerator generator, String line, Platform platform) {
        System.out.println("Input line: " + line + " (platform=" + platform.getId() + ")");
        ParsedLine parsed = lineParser.parseLogicLine(line).orElseThrow();
        String ladder = generator.generate(parsed.condition(), parsed.outputs(), platform);
        System.out.println("Generated ladder:\n" + ladder);
        return ladder;
    }

    private String generate(String line, Platform platform) {
        return generate(new LadderGenerator(), line, platform);
    }

    @Test
    void testSeriesContactsWithNormallyClosedContact() {
        System.out.println("--- Running test: testSeriesContactsWithNormallyClosedContact ---");
        String ladder = generate("IF Start AND NOT Stop THEN Motor", Platform.ALLEN_BRADLEY);

        assertEquals("// Rung\n"
                + "|----[ ] Start----[/] [ ] Stop----( )----|\n"
                + "     Motor\n"
                + "\n", ladder);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMultipleOutputsAreCommaJoined() {
        System.out.println("--- Running test: testMultipleOutputsAreCommaJoined ---");
        String ladder = generate("IF Start THEN Motor,Lamp , Horn", Platform.OMRON);

        assertTrue(ladder.contains("     Motor, Lamp, Horn\n"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTimerRungForSiemens() {
        System.out.println("--- Running test: testTimerRungForSiemens ---");
        String ladder = generate("IF Level > 10 THEN TON Timer1, 5s", Platform.SIEMENS);

        assertEquals("// Rung\n"
                + "|----[ ] Level > 10----( )----|\n"
                + "     TON Timer1 Time: 5s\n"
                + "\n", ladder);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTopLevelOrBecomesParallelRungs() {
        System.out.println("--- Running test: testTopLevelOrBecomesParallelRungs ---");
        String ladder = generate("IF A OR B THEN Out1", Platform.SIEMENS);

        assertEquals("// Rung\n"
                + "|----[ ] A----( )----|\n"
                + "     Out1\n"
                + "\n"
                + "\n"
                + "// Rung\n"
                + "|----[ ] B----( )----|\n"
                + "     Out1\n"
                + "\n", ladder);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNestedOrExpandsIntoRungs() {
        System.out.println("--- Running test: testNestedOrExpandsIntoRungs ---");
        ParsedLine parsed = lineParser.parseLogicLine("IF A AND (B OR C) THEN Out").orElseThrow();
        List<String> rungs = new LadderGenerator().generateRungs(parsed.condition(), parsed.outputs(), Platform.OMRON);

        assertEquals(2, rungs.size());
        assertTrue(rungs.get(0).contains("|----[ ] A----[ ] B----( )----|"));
        assertTrue(rungs.get(1).contains("|----[ ] A----[ ] C----( )----|"));

        String negated = generate("IF NOT (A OR B) THEN Out", Platform.OMRON);
        assertTrue(negated.contains("|----[/] [ ] A----[/] [ ] B----( )----|"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNestedOrRejectedWhenExpansionDisabled() {
        System.out.println("--- Running test: testNestedOrRejectedWhenExpansionDisabled ---");
        LadderGenerator strict = new LadderGenerator(false, 64);
        ParsedLine parsed = lineParser.parseLogicLine("IF A AND (B OR C) THEN Out").orElseThrow();

        LadderGenerationException e = assertThrows(LadderGenerationException.class,
                () -> strict.generate(parsed.condition(), parsed.outputs(), Platform.OMRON));
        System.out.println("Caught expected exception: " + e.getMessage());

        // 顶层 OR 不受影响
        String ladder = generate(strict, "IF A OR B AND C THEN Out", Platform.OMRON);
        assertTrue(ladder.contains("|----[ ] A----( )----|"));
        assertTrue(ladder.contains("|----[ ] B----[ ] C----( )----|"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTimerFormatsPerPlatform() {
        System.out.println("--- Running test: testTimerFormatsPerPlatform ---");
        TimerNode timer = new TimerNode(BlockType.TOF, "T2", "500ms");

        assertEquals("TOF T2 Time: 500ms", Platform.SIEMENS.formatTimer(timer));
        assertEquals("TOF T2 Preset: 500ms", Platform.ALLEN_BRADLEY.formatTimer(timer));
        assertEquals("TOF T2 K500ms", Platform.MITSUBISHI.formatTimer(timer));
        assertEquals("TOF T2 500ms", Platform.OMRON.formatTimer(timer));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCounterFormatsPerPlatform() {
        System.out.println("--- Running test: testCounterFormatsPerPlatform ---");
        CounterNode counter = new CounterNode(BlockType.CTD, "C1", "20");

        assertEquals("CTD C1 Count: 20", Platform.SIEMENS.formatCounter(counter));
        assertEquals("CTD C1 Preset: 20", Platform.ALLEN_BRADLEY.formatCounter(counter));
        assertEquals("CTD C1 K20", Platform.MITSUBISHI.formatCounter(counter));
        assertEquals("CTD C1 20", Platform.OMRON.formatCounter(counter));

        String ladder = generate("IF Pulse THEN CTU Parts, 100", Platform.MITSUBISHI);
        assertTrue(ladder.endsWith("     CTU Parts K100\n\n"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnknownPlatformFallsBackToOmron() {
        System.out.println("--- Running test: testUnknownPlatformFallsBackToOmron ---");
        assertEquals(Platform.OMRON, Platform.fromId("beckhoff"));
        assertEquals(Platform.OMRON, Platform.fromId(null));
        assertEquals(Platform.OMRON, Platform.fromId("Allen-Bradley"));
        assertEquals(Platform.ALLEN_BRADLEY, Platform.fromId("allen-bradley"));
        assertFalse(Platform.isKnown("beckhoff"));
        assertFalse(Platform.isKnown("SIEMENS"));
        assertTrue(Platform.isKnown("siemens"));

        ParsedLine parsed = lineParser.parseLogicLine("IF A THEN TON T1, 2s").orElseThrow();
        String ladder = new LadderGenerator().generate(parsed.condition(), parsed.outputs(), "beckhoff");
        assertTrue(ladder.contains("     TON T1 2s\n"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testOrCannotRenderInline() {
        System.out.println("--- Running test: testOrCannotRenderInline ---");
        ContactRenderer renderer = new ContactRenderer();
        assertTrue(new OrNode(new VariableNode("A"), new VariableNode("B")).accept(renderer).isEmpty());
        assertTrue(new TimerNode(BlockType.TON, "T", "1s").accept(renderer).isEmpty());
        assertEquals("[ ] A", new VariableNode("A").accept(renderer).orElseThrow());
        System.out.println("Result: Test PASSED.\n");
    }
}
