package com.ciro.jdirective.standalone;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private Path template;
    private Path data;

    @BeforeEach
    void setUp() throws IOException {
        template = dir.resolve("page.html");
        data = dir.resolve("data.json");
        Files.writeString(template,
            "<div s:if=\"score > 50\">win</div><div s:else>lose</div><p>{{ 1 / 0 }}</p>");
        Files.writeString(data, "{ \"score\": 80 }");
    }

    private int run(String... args) {
        return Main.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("request: html limpio en stdout y errores en stderr")
    void rendersRequest() {
        int code = run(template.toString(), data.toString(), "--request");

        assertThat(code).isEqualTo(Main.OK);
        assertThat(stdout()).contains("<div>win</div>").doesNotContain("lose").doesNotContain("s:if");
        assertThat(stderr()).contains("error [EXPRESSION] Division by zero");
    }

    @Test
    @DisplayName("modo autor con componente: solo el body")
    void rendersEditorFragment() {
        int code = run(template.toString(), data.toString(), "--editor", "--component");

        assertThat(code).isEqualTo(Main.OK);
        assertThat(stdout()).startsWith("<div").doesNotContain("<html").contains("data-sui-hide=\"true\"");
    }

    @Test
    @DisplayName("sin fichero de datos el contexto está vacío")
    void rendersWithoutData() throws IOException {
        Files.writeString(template, "<p>[{{ name }}]</p>");

        int code = run(template.toString(), "--request");

        assertThat(code).isEqualTo(Main.OK);
        assertThat(stdout()).contains("<p>[]</p>");
        assertThat(stderr()).isEmpty();
    }

    @Test
    void usageErrors() {
        assertThat(run()).isEqualTo(Main.USAGE);
        assertThat(run(template.toString(), "--nope")).isEqualTo(Main.USAGE);
        assertThat(run(template.toString(), "--locale")).isEqualTo(Main.USAGE);
        assertThat(stderr()).contains("Usage:");
    }

    @Test
    void missingFilesFail() {
        assertThat(run(dir.resolve("missing.html").toString())).isEqualTo(Main.FAILED);
        assertThat(stderr()).contains("Cannot read input");
    }

    @Test
    void invalidJsonFails() throws IOException {
        Files.writeString(data, "{ nope");

        assertThat(run(template.toString(), data.toString())).isEqualTo(Main.FAILED);
    }

    @Test
    @DisplayName("traduce con un idioma del directorio indicado")
    void rendersWithLocale() throws IOException {
        Path locales = Files.createDirectories(dir.resolve("locales"));
        Files.writeString(locales.resolve("es.json"), "{ \"messages\": { \"Hello\": \"Hola\" } }");
        Files.writeString(template, "<p s:trans-text=\"\">{{ '::Hello' }}</p>");

        int code = run(template.toString(), "--request", "--locales", locales.toString(), "--locale", "es");

        assertThat(code).isEqualTo(Main.OK);
        assertThat(stdout()).contains("<p>Hola</p>");
    }

    @Test
    void unknownLocaleFails() {
        int code = run(template.toString(), "--locales", dir.toString(), "--locale", "xx");

        assertThat(code).isEqualTo(Main.FAILED);
        assertThat(stderr()).contains("Locale not found: xx");
    }
}
