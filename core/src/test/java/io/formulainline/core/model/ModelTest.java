package io.formulainline.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ModelTest {

    @Test
    void spanContainment() {
        Span outer = new Span(0, 10);

        assertThat(outer.strictlyContains(new Span(2, 5))).isTrue();
        assertThat(outer.strictlyContains(new Span(0, 10))).isFalse();
        assertThat(outer.strictlyContains(new Span(5, 11))).isFalse();
        assertThat(new Span(7, 14).slice("DOUBLE(QUAD(1))")).isEqualTo("QUAD(1)");
        assertThat(new Span(3, 3).length()).isZero();
    }

    @Test
    void invalidSpan() {
        assertThatThrownBy(() -> new Span(5, 4)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void operatorsBySymbol() {
        assertThat(Operator.fromSymbol("<>")).contains(Operator.NOT_EQUAL);
        assertThat(Operator.fromSymbol("%")).isEmpty();
        assertThat(Operator.values()).filteredOn(Operator::isUnary).containsExactly(Operator.PLUS, Operator.MINUS);
    }

    @Test
    void definitionRejectsDuplicateParameters() {
        assertThatThrownBy(() -> FormulaDefinition.of("F", List.of("x", "x"), "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("duplicate parameter 'x' in formula 'F'");
    }

    @Test
    void definitionDefaults() {
        FormulaDefinition definition = FormulaDefinition.of("F", List.of("a", "b"), "a + b");

        assertThat(definition.parameterNames()).containsExactly("a", "b");
        assertThat(definition.version()).isEqualTo("1.0.0");
        assertThat(definition.source()).isNull();
    }
}
