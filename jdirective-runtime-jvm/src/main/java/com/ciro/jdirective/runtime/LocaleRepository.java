package com.ciro.jdirective.runtime;

import com.ciro.jdirective.Locale;
import com.ciro.jdirective.ObjectMapperFactory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Idiomas en disco: un fichero {@code <root>/<nombre>.json} por idioma.
 *
 * <pre>
 * {
 *   "keys":            { "home.title": "Inicio" },
 *   "messages":        { "Hello": "Hola" },
 *   "script_messages": { "bye": "Adiós" },
 *   "formats":         { "price": "{0} €" }
 * }
 * </pre>
 *
 * Los formatos son patrones {@link MessageFormat} con el texto del elemento como {@code {0}}.
 */
public class LocaleRepository {

    private static final Logger log = LoggerFactory.getLogger(LocaleRepository.class);

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_-]+");

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LocaleFile(
        @JsonProperty("keys") Map<String, String> keys,
        @JsonProperty("messages") Map<String, String> messages,
        @JsonProperty("script_messages") Map<String, String> scriptMessages,
        @JsonProperty("formats") Map<String, String> formats) {}

    private final Path root;
    private final ObjectMapper mapper;
    private final Cache<String, Optional<Locale>> cache;

    public LocaleRepository(Path root, long maximumSize, long expireAfterAccessMinutes) {
        this.root = root;
        this.mapper = ObjectMapperFactory.shared();
        this.cache = Caffeine.newBuilder()
                .expireAfterAccess(expireAfterAccessMinutes, TimeUnit.MINUTES)
                .maximumSize(maximumSize)
                .build();
    }

    /** Idioma por nombre ({@code es}, {@code en-us}); vacío si no hay fichero. */
    public Optional<Locale> find(String name) {
        return find(name, false);
    }

    public Optional<Locale> find(String name, boolean bypassCache) {
        if (name == null || !NAME.matcher(name).matches()) return Optional.empty();
        String key = name.toLowerCase(java.util.Locale.ROOT);
        if (bypassCache) return read(key);
        return cache.get(key, this::read);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private Optional<Locale> read(String name) {
        Path file = root.resolve(name + ".json");
        if (!Files.isRegularFile(file)) {
            log.debug("No locale file for {} in {}", name, root);
            return Optional.empty();
        }
        try {
            LocaleFile data = mapper.readValue(file.toFile(), LocaleFile.class);
            return Optional.of(toLocale(name, data));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read locale " + file, e);
        }
    }

    static Locale toLocale(String name, LocaleFile data) {
        Locale.Builder b = Locale.builder(name)
            .keys(data.keys())
            .messages(data.messages())
            .scriptMessages(data.scriptMessages());
        if (data.formats() != null) {
            data.formats().forEach((fmt, pattern) -> {
                MessageFormat format = new MessageFormat(pattern, java.util.Locale.forLanguageTag(name));
                b.format(fmt, text -> {
                    // MessageFormat no es thread-safe
                    synchronized (format) {
                        return format.format(new Object[] {text});
                    }
                });
            });
        }
        return b.build();
    }
}
