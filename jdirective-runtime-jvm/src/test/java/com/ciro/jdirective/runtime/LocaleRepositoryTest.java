package com.ciro.jdirective.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import com.ciro.jdirective.Locale;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocaleRepositoryTest {

    @TempDir
    Path dir;

    private LocaleRepository repo;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(dir.resolve("es.json"), """
            {
              "keys": { "home.title": "Inicio" },
              "messages": { "Hello": "Hola" },
              "script_messages": { "bye": "Adiós" },
              "formats": { "price": "{0} €" },
              "unused": true
            }
            """);
        repo = new LocaleRepository(dir, 10, 5);
    }

    @Test
    @DisplayName("lee claves, mensajes, mensajes de script y formatos")
    void readsLocaleFile() {
        Locale es = repo.find("es").orElseThrow();

        assertThat(es.name()).isEqualTo("es");
        assertThat(es.keys()).containsEntry("home.title", "Inicio");
        assertThat(es.messages()).containsEntry("Hello", "Hola");
        assertThat(es.scriptMessages()).containsEntry("bye", "Adiós");
        assertThat(es.format("price", "12")).isEqualTo("12 €");
        assertThat(es.format("unknown", "12")).isEqualTo("12");
    }

    @Test
    void missingLocaleIsEmpty() {
        assertThat(repo.find("fr")).isEmpty();
        assertThat(repo.find("../etc/passwd")).isEmpty();
        assertThat(repo.find(null)).isEmpty();
    }

    @Test
    @DisplayName("la caché sirve la versión leída hasta invalidar o saltarla")
    void cacheAndBypass() throws IOException {
        repo.find("es");
        Files.writeString(dir.resolve("es.json"), "{ \"messages\": { \"Hello\": \"Buenas\" } }");

        assertThat(repo.find("es").map(l -> l.messages().get("Hello"))).contains("Hola");
        assertThat(repo.find("es", true).map(l -> l.messages().get("Hello"))).contains("Buenas");

        repo.invalidateAll();
        Optional<Locale> reloaded = repo.find("ES");
        assertThat(reloaded.map(l -> l.messages().get("Hello"))).contains("Buenas");
    }
}
