package com.phasecontrol.generator.codegen.condition;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.phasecontrol.generator.codegen.model.CompiledCondition;
import com.phasecontrol.generator.codegen.model.ConditionLiteral;
import com.phasecontrol.generator.codegen.model.ConditionSpec;
import com.phasecontrol.generator.codegen.model.LiteralRef;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConditionCompiler.
 */
class ConditionCompilerTest {

    private static final String STEP_FLAG = "StepFlag[3].Flag";

    private final ConditionCompiler compiler = new ConditionCompiler();

    @Test
    void testNoSpecGatesOnStepFlag() {
        CompiledCondition condition = compiler.compile(null, STEP_FLAG);

        assertThat(condition.getDisjuncts()).containsExactly(List.of(LiteralRef.of(STEP_FLAG, false)));
        assertThat(condition.isBranched()).isFalse();
    }

    @Test
    void testSpecWithoutLiteralsGatesOnStepFlag() {
        ConditionSpec spec = ConditionSpec.builder().expression("X1 OR X2").build();

        assertThat(compiler.compile(spec, STEP_FLAG).getDisjuncts())
                .containsExactly(List.of(LiteralRef.of(STEP_FLAG, false)));
    }

    @Test
    void testSingleLabel() {
        ConditionSpec spec = ConditionSpec.builder()
                .expression("X1")
                .literal(literal("X1", "A", false))
                .build();

        assertThat(compiler.compile(spec, STEP_FLAG).getDisjuncts())
                .containsExactly(List.of(LiteralRef.of("A", false)));
    }

    @Test
    void testSingleLabelWithSurroundingWhitespace() {
        ConditionSpec spec = ConditionSpec.builder()
                .expression("  X1 ")
                .literal(literal("X1", "A", true))
                .build();

        assertThat(compiler.compile(spec, STEP_FLAG).getDisjuncts())
                .containsExactly(List.of(LiteralRef.of("A", true)));
    }

    @Test
    void testSingleLabelWithoutMatchingLiteralFallsBackToStepFlag() {
        ConditionSpec spec = ConditionSpec.builder()
                .expression("X1")
                .literal(literal("X2", "B", false))
                .build();

        assertThat(compiler.compile(spec, STEP_FLAG).getDisjuncts())
                .containsExactly(List.of(LiteralRef.of(STEP_FLAG, false)));
    }

    @Test
    void testDisjunction() {
        ConditionSpec spec = ConditionSpec.builder()
                .expression("X1 OR X2")
                .literal(literal("X1", "A", false))
                .literal(literal("X2", "B", true))
                .build();

        CompiledCondition condition = compiler.compile(spec, STEP_FLAG);

        assertThat(condition.isBranched()).isTrue();
        assertThat(condition.getDisjuncts()).containsExactly(
                List.of(LiteralRef.of("A", false)),
                List.of(LiteralRef.of("B", true)));
    }

    @Test
    void testConjunctionInsideDisjunction() {
        ConditionSpec spec = ConditionSpec.builder()
                .expression("(X1 AND X2) OR X3")
                .literal(literal("X1", "t1", false))
                .literal(literal("X2", "t2", false))
                .literal(literal("X3", "t3", false))
                .build();

        assertThat(compiler.compile(spec, STEP_FLAG).getDisjuncts()).containsExactly(
                List.of(LiteralRef.of("t1", false), LiteralRef.of("t2", false)),
                List.of(LiteralRef.of("t3", false)));
    }

    @Test
    void testParenthesizedConjunctionWithoutOr() {
        ConditionSpec spec = ConditionSpec.builder()
                .expression("(X1 AND X2)")
                .literal(literal("X1", "t1", false))
                .literal(literal("X2", "t2", true))
                .build();

        CompiledCondition condition = compiler.compile(spec, STEP_FLAG);

        assertThat(condition.isBranched()).isFalse();
        assertThat(condition.getDisjuncts()).containsExactly(
                List.of(LiteralRef.of("t1", false), LiteralRef.of("t2", true)));
    }

    @Test
    void testUnknownLabelIsDropped() {
        ConditionSpec spec = ConditionSpec.builder()
                .expression("X1 AND X5")
                .literal(literal("X1", "A", false))
                .literal(literal("X2", "B", false))
                .build();

        assertThat(compiler.compile(spec, STEP_FLAG).getDisjuncts())
                .containsExactly(List.of(LiteralRef.of("A", false)));
    }

    @Test
    void testCompilationIsDeterministic() {
        ConditionSpec spec = ConditionSpec.builder()
                .expression("(X1 AND X2) OR (X3 AND X1)")
                .literal(literal("X1", "t1", false))
                .literal(literal("X2", "t2", true))
                .literal(literal("X3", "t3", false))
                .build();

        assertThat(compiler.compile(spec, STEP_FLAG)).isEqualTo(compiler.compile(spec, STEP_FLAG));
    }

    private static ConditionLiteral literal(String label, String tag, boolean negated) {
        return ConditionLiteral.builder().label(label).tag(tag).negated(negated).build();
    }
}
