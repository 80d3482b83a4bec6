package com.ciro.jdirective.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ciro.jdirective.error.ExpressionException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PathExpressionGatewayTest {

    record User(String name, int age) {}

    public static class Account {
        private final boolean active;

        public Account(boolean active) {
            this.active = active;
        }

        public boolean isActive() {
            return active;
        }

        public String getOwner() {
            return "ann";
        }
    }

    private final PathExpressionGateway gateway = new PathExpressionGateway();

    private final DataContext ctx = DataContext.of(Map.of(
        "score", 80,
        "ratio", 0.5,
        "name", "Ann",
        "user", new User("Bob", 42),
        "account", new Account(true),
        "items", List.of("a", "b", "c"),
        "tags", new String[] {"x", "y"},
        "prefs", Map.of("theme", "dark", "1", "one")));

    private Object exec(String expression) {
        return gateway.exec(expression, ctx);
    }

    @Nested
    class Exec {

        @Test
        @DisplayName("un entero que no cabe en long se lee como BigDecimal")
        void integerBeyondLong() {
            assertThat(exec("99999999999999999999")).isEqualTo(new BigDecimal("99999999999999999999"));
            assertThat(exec("-99999999999999999999")).isEqualTo(new BigDecimal("-99999999999999999999"));
        }

        @Test
        @DisplayName("expresión desnuda y envuelta en un bloque dan el mismo valor")
        void bareAndWrapped() {
            assertThat(exec("score > 50")).isEqualTo(true);
            assertThat(exec("{{ score > 50 }}")).isEqualTo(true);
            assertThat(exec("  {{ score }}  ")).isEqualTo(80);
        }

        @Test
        void paths() {
            assertThat(exec("user.name")).isEqualTo("Bob");
            assertThat(exec("user.age + 1")).isEqualTo(43L);
            assertThat(exec("account.active")).isEqualTo(true);
            assertThat(exec("account.owner")).isEqualTo("ann");
            assertThat(exec("items[1]")).isEqualTo("b");
            assertThat(exec("items.length")).isEqualTo(3);
            assertThat(exec("tags[0]")).isEqualTo("x");
            assertThat(exec("prefs.theme")).isEqualTo("dark");
            assertThat(exec("prefs['theme']")).isEqualTo("dark");
            assertThat(exec("prefs[1]")).isEqualTo("one");
        }

        @Test
        @DisplayName("variables y propiedades desconocidas valen null")
        void unknownIsNull() {
            assertThat(exec("nope")).isNull();
            assertThat(exec("nope.deeper.still")).isNull();
            assertThat(exec("items[10]")).isNull();
        }

        @Test
        void operators() {
            assertThat(exec("1 + 2 * 3")).isEqualTo(7L);
            assertThat(exec("(1 + 2) * 3")).isEqualTo(9L);
            assertThat(exec("7 / 2")).isEqualTo(3.5);
            assertThat(exec("8 / 2")).isEqualTo(4L);
            assertThat(exec("7 % 4")).isEqualTo(3L);
            assertThat(exec("ratio * 2")).isEqualTo(1.0);
            assertThat(exec("-score")).isEqualTo(-80L);
            assertThat(exec("'a' + 1")).isEqualTo("a1");
            assertThat(exec("score >= 80 && name == 'Ann'")).isEqualTo(true);
            assertThat(exec("score < 10 || !account.active")).isEqualTo(false);
            assertThat(exec("score != 80")).isEqualTo(false);
            assertThat(exec("\"b\" > \"a\"")).isEqualTo(true);
        }

        @Test
        @DisplayName("&& y || cortocircuitan")
        void shortCircuit() {
            assertThat(exec("false && 1 / 0")).isEqualTo(false);
            assertThat(exec("true || 1 / 0")).isEqualTo(true);
        }

        @Test
        void ternaryAndFunctions() {
            assertThat(exec("score > 50 ? 'win' : 'lose'")).isEqualTo("win");
            assertThat(exec("len(items)")).isEqualTo(3);
            assertThat(exec("empty(nope)")).isEqualTo(true);
            assertThat(exec("upper(name)")).isEqualTo("ANN");
            assertThat(exec("lower('ABC')")).isEqualTo("abc");
            assertThat(exec("null")).isNull();
            assertThat(exec("'it\\'s'")).isEqualTo("it's");
        }

        @Test
        void errors() {
            assertThatThrownBy(() -> exec("score >")).isInstanceOf(ExpressionException.class);
            assertThatThrownBy(() -> exec("1 / 0")).isInstanceOf(ExpressionException.class)
                .hasMessage("Division by zero");
            assertThatThrownBy(() -> exec("name > 1")).isInstanceOf(ExpressionException.class)
                .hasMessageStartingWith("Cannot compare");
            assertThatThrownBy(() -> exec("shout(name)")).isInstanceOf(ExpressionException.class);
            assertThatThrownBy(() -> exec("")).isInstanceOf(ExpressionException.class);
        }

        @Test
        @DisplayName("el error conserva la expresión original")
        void errorCarriesExpression() {
            assertThatThrownBy(() -> exec("1 / 0"))
                .isInstanceOfSatisfying(ExpressionException.class, e -> assertThat(e.expression()).isEqualTo("1 / 0"));
        }

        @Test
        @DisplayName("texto mixto se interpola como texto")
        void mixedTextIsInterpolated() {
            assertThat(exec("Hola {{ name }}")).isEqualTo("Hola Ann");
        }
    }

    @Nested
    class Replace {

        @Test
        void textWithoutStatementsIsUnchanged() {
            Interpolation res = gateway.replace("plain", ctx);

            assertThat(res.hadExpression()).isFalse();
            assertThat(res.text()).isEqualTo("plain");
        }

        @Test
        void interpolatesEverySpan() {
            Interpolation res = gateway.replace("{{ name }} has {{ score }} ({{ ratio }})", ctx);

            assertThat(res.hadExpression()).isTrue();
            assertThat(res.single()).isFalse();
            assertThat(res.text()).isEqualTo("Ann has 80 (0.5)");
        }

        @Test
        @DisplayName("un único bloque conserva el valor sin convertir")
        void singleKeepsValue() {
            Interpolation res = gateway.replace(" {{ account.active }} ", ctx);

            assertThat(res.single()).isTrue();
            assertThat(res.value()).isEqualTo(true);
        }

        @Test
        @DisplayName("colecciones y mapas salen como JSON")
        void collectionsAsJson() {
            assertThat(gateway.replace("{{ items }}", ctx).text()).isEqualTo("[\"a\",\"b\",\"c\"]");
        }

        @Test
        @DisplayName("un bloque que falla queda literal y el error viaja en el resultado")
        void failingSpanIsLiteral() {
            Interpolation res = gateway.replace("a {{ 1 / 0 }} b {{ name }}", ctx);

            assertThat(res.text()).isEqualTo("a {{ 1 / 0 }} b Ann");
            assertThat(res.errors()).hasSize(1);
            assertThat(res.single()).isFalse();
        }

        @Test
        void nullSpanIsEmpty() {
            assertThat(gateway.replace("[{{ nope }}]", ctx).text()).isEqualTo("[]");
        }
    }

    @Test
    @DisplayName("assign escribe en el contexto")
    void assign() {
        gateway.assign(ctx, "x", 5);

        assertThat(exec("x * 2")).isEqualTo(10L);
    }
}
