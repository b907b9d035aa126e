package com.processdoc.analyzer.expression;

import com.processdoc.analyzer.model.Rule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExpressionFlattener.
 */
class ExpressionFlattenerTest {

    private final ExpressionFlattener flattener = new ExpressionFlattener();

    @Test
    void testNestedIifChainBecomesOneRulePerCondition() {
        List<Rule> rules = flattener.flatten(
                "IIF(A>0, 'Pos', IIF(A<0, 'Neg', IIF(A=0, 'Zero', 'Unknown')))").orElseThrow();

        assertThat(rules).containsExactly(
                Rule.of("A>0", "'Pos'"),
                Rule.of("A<0", "'Neg'"),
                Rule.of("A=0", "'Zero'"),
                Rule.otherwise("'Unknown'"));
        assertThat(rules.get(3).getCondition()).isEqualTo("Default - When nothing fits the above cases");
    }

    @Test
    void testSimpleIifWithQuotedOutcomes() {
        List<Rule> rules = flattener.flatten("IIF(A=B,\"Yes\",\"No\")").orElseThrow();

        assertThat(rules).containsExactly(Rule.of("A=B", "\"Yes\""), Rule.otherwise("\"No\""));
    }

    @Test
    void testThreeLevelIifChain() {
        List<Rule> rules = flattener.flatten("IIF(C1,R1,IIF(C2,R2,IIF(C3,R3,R4)))").orElseThrow();

        assertThat(rules).hasSize(4);
        assertThat(rules.get(2)).isEqualTo(Rule.of("C3", "R3"));
        assertThat(rules.get(3).coversRemainingCases()).isTrue();
        assertThat(rules.get(3).getOutcome()).isEqualTo("R4");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "IIF(C1,R1,IIF(C2,R2,IIF(C3,R3,R4)))",
            "CASE WHEN Status = 'A' THEN 'Active' WHEN Status = 'D' THEN 'Inactive' ELSE 'Unknown' END",
            "IIF(Score >= 50, IIF(Score >= 80, 'Merit', 'Pass'), 'Fail')"
    })
    void testFlatteningKeepsEveryOutcomeOnce(String expression) {
        List<String> outcomes = flattener.flatten(expression).orElseThrow().stream()
                .map(Rule::getOutcome)
                .toList();

        assertThat(outcomes).doesNotHaveDuplicates();
        outcomes.forEach(outcome -> assertThat(expression).contains(outcome));
    }

    @Test
    void testCaseWithStatusLabels() {
        List<Rule> rules = flattener.flatten(
                "CASE WHEN Status = 'A' THEN 'Active' WHEN Status = 'D' THEN 'Inactive' ELSE 'Unknown' END").orElseThrow();

        assertThat(rules).hasSize(3);
        assertThat(rules.get(2)).isEqualTo(Rule.of("ELSE", "'Unknown'"));
    }

    @Test
    void testCaseWithElse() {
        List<Rule> rules = flattener.flatten(
                "CASE WHEN Score > 90 THEN 'A' WHEN Score > 80 THEN 'B' ELSE 'C' END").orElseThrow();

        assertThat(rules).containsExactly(
                Rule.of("Score > 90", "'A'"),
                Rule.of("Score > 80", "'B'"),
                Rule.of("ELSE", "'C'"));
    }

    @Test
    void testCaseWithoutElse() {
        List<Rule> rules = flattener.flatten("CASE WHEN x = 1 THEN 'one' END").orElseThrow();

        assertThat(rules).containsExactly(Rule.of("x = 1", "'one'"));
    }

    @Test
    void testOutcomeKeepsNestedCallsAndCommas() {
        List<Rule> rules = flattener.flatten("IIF(Status = 'A', CONCAT(First, ', ', Last), 'n/a')").orElseThrow();

        assertThat(rules).containsExactly(
                Rule.of("Status = 'A'", "CONCAT(First, ', ', Last)"),
                Rule.otherwise("'n/a'"));
    }

    @Test
    void testKeywordsAreCaseInsensitive() {
        List<Rule> rules = flattener.flatten("iif (Flag = 1, 'Yes', 'No')").orElseThrow();

        assertThat(rules).containsExactly(Rule.of("Flag = 1", "'Yes'"), Rule.otherwise("'No'"));
    }

    @Test
    void testMalformedNestedElseBecomesDefaultOutcome() {
        List<Rule> rules = flattener.flatten("IIF(A, B, IIF(C, D))").orElseThrow();

        assertThat(rules).containsExactly(Rule.of("A", "B"), Rule.otherwise("IIF(C, D)"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "   ",
            "Amount * 1.2",
            "IIF(A, B)",
            "IIF(A, B, C, D)",
            "IIF(A, B, C",
            "IIF(A, B, C) + 1",
            "1 + IIF(A, B, C)",
            "CASE Status END",
            "CASE WHEN x = 1 THEN END"
    })
    void testUnrecognizedExpressionsYieldNothing(String expression) {
        assertThat(flattener.flatten(expression)).isEmpty();
        assertThat(flattener.isConditional(expression)).isFalse();
    }

    @Test
    void testSplitIifArgumentsRespectsParenthesisDepth() {
        assertThat(ExpressionFlattener.splitIifArguments("IIF(f(a, b), g(c), d)"))
                .containsExactly("f(a, b)", "g(c)", "d");
        assertThat(ExpressionFlattener.splitIifArguments("IIF(a, b, c) trailing")).isNull();
        assertThat(ExpressionFlattener.splitIifArguments("NOT_IIF(a, b, c)")).isNull();
    }

    @Test
    void testRulesCoverRemainingCasesOnlyForDefaultAndElse() {
        assertThat(Rule.otherwise("x").coversRemainingCases()).isTrue();
        assertThat(Rule.of(Rule.ELSE_CONDITION, "x").coversRemainingCases()).isTrue();
        assertThat(Rule.of("A > 1", "x").coversRemainingCases()).isFalse();
    }
}
