package com.ciro.jdirective.directive;

import static org.assertj.core.api.Assertions.assertThat;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

class DirectiveSetTest {

    private static Element element(String html) {
        return Jsoup.parseBodyFragment(html).body().child(0);
    }

    @Test
    void readsDirectivesOnce() {
        DirectiveSet ds = DirectiveSet.of(element(
            "<li s:for=\"items\" s:for-item=\"x\" s:if=\"x.off\" class=\"c\" s:trans-attr-title=\"k1,k2\" s:attr-disabled=\"x.locked\"></li>"));

        assertThat(ds.has(Directive.FOR)).isTrue();
        assertThat(ds.value(Directive.FOR)).isEqualTo("items");
        assertThat(ds.valueOr(Directive.FOR_ITEM, "item")).isEqualTo("x");
        assertThat(ds.valueOr(Directive.FOR_INDEX, "index")).isEqualTo("index");
        assertThat(ds.has(Directive.IF)).isTrue();
        assertThat(ds.translatedAttributes()).containsEntry("title", "k1,k2");
        assertThat(ds.booleanAttributes()).containsEntry("disabled", "x.locked");
        assertThat(ds.isAssignment()).isFalse();
        assertThat(ds.isEmpty()).isFalse();
    }

    @Test
    void plainElementIsEmpty() {
        assertThat(DirectiveSet.of(element("<p class=\"a\">x</p>")).isEmpty()).isTrue();
        assertThat(DirectiveSet.of(element("<p>x</p>")).isEmpty()).isTrue();
    }

    @Test
    void setElementIsAssignment() {
        assertThat(DirectiveSet.of(element("<s:set name=\"a\" value=\"1\"></s:set>")).isAssignment()).isTrue();
        assertThat(DirectiveSet.of(element("<div s:set name=\"a\" value=\"1\"></div>")).isAssignment()).isTrue();
    }

    @Test
    void clientHooks() {
        assertThat(Directive.fromAttribute("s:event").isClientHook()).isTrue();
        assertThat(Directive.fromAttribute("s:if").isClientHook()).isFalse();
        assertThat(Directive.fromAttribute("s:unknown")).isNull();
    }
}
