package com.wzz.fulfillcrm.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuantityFormulaEvaluatorTest {

    private Map<String, BigDecimal> vars() {
        Map<String, BigDecimal> vars = new HashMap<>();
        vars.put("itemsCount", new BigDecimal("3"));
        vars.put("totalWeight", new BigDecimal("12.5"));
        vars.put("totalVolume", new BigDecimal("0.4"));
        return vars;
    }

    @Test
    void evaluatesOperatorPrecedenceAndParentheses() {
        assertThat(QuantityFormulaEvaluator.evaluate("1 + 2 * 3", vars())).isEqualByComparingTo("7");
        assertThat(QuantityFormulaEvaluator.evaluate("(1 + 2) * 3", vars())).isEqualByComparingTo("9");
        assertThat(QuantityFormulaEvaluator.evaluate("-2 + 5", vars())).isEqualByComparingTo("3");
        assertThat(QuantityFormulaEvaluator.evaluate("-(itemsCount - 1)", vars())).isEqualByComparingTo("-2");
    }

    @Test
    void resolvesVariables() {
        assertThat(QuantityFormulaEvaluator.evaluate("totalWeight / 5", vars())).isEqualByComparingTo("2.5");
        assertThat(QuantityFormulaEvaluator.evaluate("itemsCount * 2 + totalVolume", vars())).isEqualByComparingTo("6.4");
    }

    @Test
    void ceilRoundsUp() {
        assertThat(QuantityFormulaEvaluator.evaluateCeil("totalWeight / 5", vars())).isEqualByComparingTo("3");
        assertThat(QuantityFormulaEvaluator.evaluateCeil("itemsCount", vars())).isEqualByComparingTo("3");
    }

    @Test
    void rejectsUnknownVariable() {
        assertThatThrownBy(() -> QuantityFormulaEvaluator.evaluate("weight * 2", vars()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsDivisionByZero() {
        assertThatThrownBy(() -> QuantityFormulaEvaluator.evaluate("itemsCount / 0", vars()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsAnythingButArithmetic() {
        assertThatThrownBy(() -> QuantityFormulaEvaluator.evaluate("Math.max(1, 2)", vars()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuantityFormulaEvaluator.evaluate("1 +", vars()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuantityFormulaEvaluator.evaluate("(1 + 2", vars()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QuantityFormulaEvaluator.evaluate("  ", vars()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
