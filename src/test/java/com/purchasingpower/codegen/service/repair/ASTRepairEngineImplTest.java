package com.purchasingpower.codegen.service.repair;

import com.github.javaparser.StaticJavaParser;
import com.purchasingpower.codegen.ast.java.JavaParsedSource;
import com.purchasingpower.codegen.ast.java.JavaSourceParser;
import com.purchasingpower.codegen.configuration.TestingProperties;
import com.purchasingpower.codegen.service.repair.passes.JavaRepairAdapter;
import com.purchasingpower.codegen.service.repair.passes.MissingReturnPass;
import com.purchasingpower.codegen.service.testing.InMemoryJavaCompiler;
import com.purchasingpower.codegen.service.testing.SandboxedJavaTestExecutor;
import com.purchasingpower.codegen.service.testing.TestCase;
import com.purchasingpower.codegen.service.testing.TestResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AST Repair Engine Tests")
class ASTRepairEngineImplTest {

    private static final String LAST_MATCH_CANDIDATE = """
            int findIndex(int[] items, int target) {
                int result = -1;
                for (int i = 0; i < items.length; i++) {
                    if (items[i] == target) {
                        result = i;
                    }
                }
                return result;
            }
            """;

    private JavaSourceParser parser;
    private ASTRepairEngine engine;

    @BeforeEach
    void setUp() {
        parser = new JavaSourceParser();
        engine = new ASTRepairEngineImpl(new JavaRepairAdapter(parser));
    }

    @Test
    @DisplayName("Should run every matching pass and report each fix")
    void testRepair_MultipleDefects_ShouldApplyPassesInOrder() {
        // Given: unreachable statement after the final return plus a last-match loop
        String code = """
                int findIndex(int[] items, int target) {
                    int result = -1;
                    for (int i = 0; i < items.length; i++) {
                        if (items[i] == target) {
                            result = i;
                        }
                    }
                    return result;
                    System.out.println("done");
                }
                """;

        // When
        RepairResult result = engine.repair(code, "findIndex");

        // Then
        assertTrue(result.isChanged());
        assertEquals(2, result.getAppliedFixes().size(), result.getAppliedFixes().toString());
        assertTrue(result.getAppliedFixes().get(0).startsWith("Removed 1 unreachable statement(s)"));
        assertTrue(result.getAppliedFixes().get(1).startsWith("Converted sentinel 'result' loop"));
        assertFalse(result.getCode().contains("println"));
        assertDoesNotThrow(() -> parser.parse(result.getCode()));
        System.out.println("✅ Fixes: " + result.getAppliedFixes());
    }

    @Test
    @DisplayName("Should be idempotent on its own output")
    void testRepair_Twice_ShouldFindNothingSecondTime() {
        // Given
        RepairResult first = engine.repair(LAST_MATCH_CANDIDATE, "findIndex");

        // When
        RepairResult second = engine.repair(first.getCode(), "findIndex");

        // Then
        assertTrue(first.isChanged());
        assertFalse(second.isChanged(), "Unexpected fixes: " + second.getAppliedFixes());
        assertEquals(first.getCode(), second.getCode());
    }

    @Test
    @DisplayName("Repaired last-match loop should return the first index when executed")
    void testRepair_LastMatchLoop_ShouldExecuteAsFirstMatch() {
        // Given
        SandboxedJavaTestExecutor executor = new SandboxedJavaTestExecutor(
                parser, new InMemoryJavaCompiler(), new TestingProperties());
        TestCase firstOfTwo = TestCase.builder()
                .name("first of two matches")
                .argument("new int[] {1, 2, 1}")
                .argument("1")
                .expected("0")
                .build();

        // When
        TestResult before = executor.execute(LAST_MATCH_CANDIDATE, "findIndex", firstOfTwo);
        RepairResult repaired = engine.repair(LAST_MATCH_CANDIDATE, "findIndex");
        TestResult after = executor.execute(repaired.getCode(), "findIndex", firstOfTwo);

        // Then
        assertFalse(before.isPassed());
        assertEquals("2", before.getActual());
        assertTrue(after.isPassed(), "Repaired code failed: " + after.getError());
        assertEquals("0", after.getActual());
        System.out.println("✅ Repaired code:\n" + repaired.getCode());
    }

    @Test
    @DisplayName("Should return input unchanged when nothing matches")
    void testRepair_CleanCode_ShouldReturnSameString() {
        // Given
        String code = "int twice(int x) {\n    return x * 2;\n}\n";

        // When
        RepairResult result = engine.repair(code, "twice");

        // Then
        assertFalse(result.isChanged());
        assertSame(code, result.getCode());
    }

    @Test
    @DisplayName("Should return unparseable or missing input unchanged")
    void testRepair_BadInput_ShouldNotThrow() {
        // Given
        String broken = "int broken(int x) { return x +; ";

        // When / Then
        assertEquals(broken, engine.repair(broken, "broken").getCode());
        assertNull(engine.repair(null, "broken").getCode());
        assertFalse(engine.repair(LAST_MATCH_CANDIDATE, null).isChanged());
    }

    @Test
    @DisplayName("Should roll back a pass that fails half way and keep running the rest")
    void testRepair_FailingPass_ShouldRollBack() {
        // Given: a pass that mutates the tree and then throws, followed by a real pass
        RepairPass<JavaParsedSource> failing = new RepairPass<>() {
            @Override
            public String getName() {
                return "FailingPass";
            }

            @Override
            public List<String> apply(JavaParsedSource source, String functionName, RepairContext context) {
                source.findMethods(functionName).get(0).getBody().orElseThrow()
                        .addStatement(0, StaticJavaParser.parseStatement("marker();"));
                throw new IllegalStateException("boom");
            }
        };
        JavaRepairAdapter javaAdapter = new JavaRepairAdapter(parser);
        LanguageRepairAdapter<JavaParsedSource> adapter = new LanguageRepairAdapter<>() {
            @Override
            public String getLanguage() {
                return javaAdapter.getLanguage();
            }

            @Override
            public JavaParsedSource parse(String code) {
                return javaAdapter.parse(code);
            }

            @Override
            public JavaParsedSource copy(JavaParsedSource source) {
                return javaAdapter.copy(source);
            }

            @Override
            public List<RepairPass<JavaParsedSource>> getPasses() {
                return List.of(failing, new MissingReturnPass());
            }
        };
        ASTRepairEngine rollbackEngine = new ASTRepairEngineImpl(adapter);

        // When
        RepairResult result = rollbackEngine.repair("int doubled(int x) {\n    int result = x * 2;\n}\n", "doubled");

        // Then
        assertEquals(List.of("Added missing 'return result;' at end of doubled()"), result.getAppliedFixes());
        assertFalse(result.getCode().contains("marker"), result.getCode());
        assertTrue(result.getCode().contains("return result;"));
        System.out.println("✅ Rolled back failing pass, kept: " + result.getAppliedFixes());
    }
}
