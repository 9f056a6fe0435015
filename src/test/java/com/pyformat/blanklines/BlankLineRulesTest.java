package com.pyformat.blanklines;

import static com.pyformat.tree.TreeFixtures.assignment;
import static com.pyformat.tree.TreeFixtures.classdef;
import static com.pyformat.tree.TreeFixtures.file;
import static com.pyformat.tree.TreeFixtures.funcdef;
import static com.pyformat.tree.TreeFixtures.pass;
import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.pyformat.model.BranchNode;
import com.pyformat.style.StyleConfig;
import com.pyformat.style.StyleOption;

/**
 * Unit tests for the generic blank-line rule, independent of any walk.
 */
class BlankLineRulesTest {

    private BlankLineRules rules;
    private TraversalState state;

    @BeforeEach
    void setUp() {
        rules = new BlankLineRules(StyleConfig.pep8());
        state = new TraversalState();
    }

    @Test
    void testDecoratorTakesPriorityOverTopLevel() {
        BranchNode f = funcdef("f", 5, 0);
        file(f);
        state.setLastWasDecorator(true);

        assertThat(rules.requiredNewlines(state, f)).isEqualTo(BlankLineRules.NO_BLANK_LINES);
    }

    @Test
    void testTopLevelUsesConfiguredValue() {
        BranchNode f = funcdef("f", 5, 0);
        file(f);

        assertThat(rules.requiredNewlines(state, f)).isEqualTo(BlankLineRules.TWO_BLANK_LINES);
    }

    @Test
    void testTopLevelConfiguredCountIsAddedToOneBlankLine() {
        BranchNode f = funcdef("f", 5, 0);
        file(f);
        BlankLineRules single = new BlankLineRules(
                StyleConfig.pep8().with(StyleOption.BLANK_LINES_AROUND_TOP_LEVEL_DEFINITION, 0));
        BlankLineRules triple = new BlankLineRules(
                StyleConfig.pep8().with(StyleOption.BLANK_LINES_AROUND_TOP_LEVEL_DEFINITION, 2));

        assertThat(single.requiredNewlines(state, f)).isEqualTo(BlankLineRules.ONE_BLANK_LINE);
        assertThat(triple.requiredNewlines(state, f)).isEqualTo(4);
    }

    @Test
    void testNestingDepthDisablesTopLevelRule() {
        BranchNode f = funcdef("f", 5, 0);
        file(f);
        state.enterFunction();

        assertThat(rules.requiredNewlines(state, f)).isEqualTo(BlankLineRules.NO_BLANK_LINES);
    }

    @Test
    void testIndentedNodeIsNotTopLevel() {
        BranchNode f = funcdef("f", 5, 4);
        file(f);

        assertThat(rules.requiredNewlines(state, f)).isEqualTo(BlankLineRules.NO_BLANK_LINES);
    }

    @Test
    void testSameClassMethodsWithPreviousStatement() {
        BranchNode a = funcdef("a", 2, 4);
        BranchNode b = funcdef("b", 5, 4);
        file(classdef("C", 1, 0, a, b));
        state.enterClass();
        state.setPreviousStatement(a);

        assertThat(rules.requiredNewlines(state, b)).isEqualTo(BlankLineRules.ONE_BLANK_LINE);
    }

    @Test
    void testNoPreviousStatementMeansNoSeparation() {
        BranchNode a = funcdef("a", 2, 4);
        BranchNode b = funcdef("b", 5, 4);
        file(classdef("C", 1, 0, a, b));
        state.enterClass();

        assertThat(rules.requiredNewlines(state, b)).isEqualTo(BlankLineRules.NO_BLANK_LINES);
    }

    @Test
    void testStatementInsideMethodCountsForItsMethod() {
        BranchNode body = assignment("x", 3, 8);
        BranchNode a = funcdef("a", 2, 4, body);
        BranchNode b = funcdef("b", 5, 4, pass(6, 8));
        file(classdef("C", 1, 0, a, b));
        state.enterClass();
        state.setPreviousStatement(body);

        assertThat(rules.requiredNewlines(state, b)).isEqualTo(BlankLineRules.ONE_BLANK_LINE);
    }

    @Test
    void testSameClassFloorIgnoresNegativeConfiguration() {
        BlankLineRules negative = new BlankLineRules(
                StyleConfig.pep8().with(StyleOption.BLANK_LINES_BETWEEN_CLASS_DEFS, -1));

        assertThat(negative.sameClassNewlines()).isEqualTo(BlankLineRules.ONE_BLANK_LINE);
    }

    @Test
    void testSameClassNewlinesFollowLargerConfiguration() {
        BlankLineRules wide = new BlankLineRules(
                StyleConfig.pep8().with(StyleOption.BLANK_LINES_BETWEEN_CLASS_DEFS, 1));

        assertThat(wide.sameClassNewlines()).isEqualTo(BlankLineRules.TWO_BLANK_LINES);
    }

    @Test
    void testRulesRequireStyle() {
        assertThatThrownBy(() -> new BlankLineRules(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
