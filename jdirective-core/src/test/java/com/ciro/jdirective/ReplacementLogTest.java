package com.ciro.jdirective;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.junit.jupiter.api.Test;

class ReplacementLogTest {

    @Test
    void appliesEditsInRecordOrder() {
        Element ul = Jsoup.parseBodyFragment("<ul><li id=\"t\">tpl</li><li>last</li></ul>").body().child(0);
        Element target = ul.getElementById("t");
        ReplacementLog log = new ReplacementLog();

        log.record(target, List.of(new Element("li").text("a"), new Element("li").text("b")));
        assertThat(ul.children()).hasSize(2);

        assertThat(log.apply()).isEqualTo(1);
        assertThat(ul.children()).extracting(Element::text).containsExactly("a", "b", "last");
    }

    @Test
    void emptyReplacementRemovesTarget() {
        Element p = Jsoup.parseBodyFragment("<p>x<b>y</b></p>").body().child(0);
        ReplacementLog log = new ReplacementLog();

        log.record(p.child(0), List.of());
        log.apply();

        assertThat(p.html()).isEqualTo("x");
    }

    @Test
    void detachedTargetsAreSkipped() {
        ReplacementLog log = new ReplacementLog();
        log.record(new TextNode("orphan"), List.of(new TextNode("x")));

        assertThat(log.apply()).isZero();
    }

    @Test
    void cannotRecordAfterApply() {
        ReplacementLog log = new ReplacementLog();
        log.apply();

        assertThat(log.apply()).isZero();
        assertThatThrownBy(() -> log.record(new TextNode("x"), List.of())).isInstanceOf(IllegalStateException.class);
    }
}
