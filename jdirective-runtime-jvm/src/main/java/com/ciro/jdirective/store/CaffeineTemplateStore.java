package com.ciro.jdirective.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CaffeineTemplateStore implements TemplateStore {

    private static final Logger log = LoggerFactory.getLogger(CaffeineTemplateStore.class);

    private final Cache<String, String> cache;

    public CaffeineTemplateStore(long maximumSize, long expireAfterAccessMinutes) {
        this.cache = Caffeine.newBuilder()
                .expireAfterAccess(expireAfterAccessMinutes, TimeUnit.MINUTES)
                .maximumSize(maximumSize)
                .removalListener((String key, String source, RemovalCause cause) -> {
                    if (cause.wasEvicted()) log.debug("Template {} evicted ({})", key, cause);
                })
                .build();
    }

    @Override
    public String get(String name, Function<String, String> loader) {
        // Caffeine no guarda nulls: una plantilla inexistente se vuelve a buscar la próxima vez
        return cache.get(name, loader);
    }

    @Override
    public void invalidate(String name) {
        cache.invalidate(name);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        return cache.estimatedSize();
    }
}
