package com.ciro.jdirective.template;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DataContextTest {

    @Test
    @DisplayName("un frame sombrea la raíz y al cerrarse la restaura")
    void scopeShadowsAndRestores() {
        DataContext ctx = DataContext.of(Map.of("item", "outer"));

        try (DataContext.Scope scope = ctx.push()) {
            scope.bind("item", "inner");
            assertThat(ctx.get("item")).isEqualTo("inner");
            assertThat(ctx.depth()).isEqualTo(1);
        }

        assertThat(ctx.get("item")).isEqualTo("outer");
        assertThat(ctx.depth()).isZero();
    }

    @Test
    @DisplayName("un nombre que no existía desaparece al cerrar el frame")
    void scopeDropsNewNames() {
        DataContext ctx = new DataContext();

        try (DataContext.Scope scope = ctx.push()) {
            scope.bind("index", 3);
            assertThat(ctx.has("index")).isTrue();
        }

        assertThat(ctx.has("index")).isFalse();
        assertThat(ctx.get("index")).isNull();
    }

    @Test
    @DisplayName("put escribe en el frame que sombrea el nombre, si no en la raíz")
    void putTargetsShadowingFrame() {
        DataContext ctx = DataContext.of(Map.of("a", 1));

        try (DataContext.Scope scope = ctx.push()) {
            scope.bind("a", 2);
            ctx.put("a", 3);
            ctx.put("b", 4);
            assertThat(ctx.get("a")).isEqualTo(3);
        }

        assertThat(ctx.get("a")).isEqualTo(1);
        assertThat(ctx.get("b")).isEqualTo(4);
    }

    @Test
    @DisplayName("cerrar un frame externo descarta también los internos olvidados")
    void closingOuterPopsInner() {
        DataContext ctx = new DataContext();
        DataContext.Scope outer = ctx.push();
        DataContext.Scope inner = ctx.push();
        inner.bind("x", 1);

        outer.close();
        outer.close();

        assertThat(ctx.depth()).isZero();
        assertThat(ctx.get("x")).isNull();
    }

    @Test
    @DisplayName("la raíz se usa por referencia y asMap no expone los frames")
    void rootIsShared() {
        Map<String, Object> root = new LinkedHashMap<>();
        DataContext ctx = new DataContext(root);
        ctx.put("x", 1);

        try (DataContext.Scope scope = ctx.push()) {
            scope.bind("y", 2);
            assertThat(ctx.asMap()).containsOnlyKeys("x");
        }

        assertThat(root).containsEntry("x", 1);
    }
}
