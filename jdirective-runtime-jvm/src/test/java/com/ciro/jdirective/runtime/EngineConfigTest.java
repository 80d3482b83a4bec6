package com.ciro.jdirective.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EngineConfigTest {

    @Nested
    class Defaults {

        @Test
        void cacheIsEnabledByDefault() {
            EngineConfig config = new EngineConfig();
            assertThat(config.cacheDisabled()).isFalse();
            assertThat(config.getCacheMaxSize()).isEqualTo(1_000);
            assertThat(config.getTemplateSuffix()).isEqualTo(".html");
        }

        @Test
        void debugDisablesCache() {
            EngineConfig config = new EngineConfig();
            config.setDebug(true);
            assertThat(config.cacheDisabled()).isTrue();
        }
    }

    @Nested
    class Loading {

        @AfterEach
        void clearOverrides() {
            System.clearProperty("jdirective.cacheMaxSize");
            System.clearProperty("jdirective.debug");
        }

        @Test
        void readsClasspathResource() {
            EngineConfig config = EngineConfig.load(EngineConfigTest.class.getClassLoader());

            assertThat(config.getTemplateRoot()).isEqualTo("src/test/templates");
            assertThat(config.getCacheMaxSize()).isEqualTo(50);
            assertThat(config.getComponentRoot()).isEqualTo("components");
        }

        @Test
        void systemPropertiesOverrideResource() {
            System.setProperty("jdirective.cacheMaxSize", "7");
            System.setProperty("jdirective.debug", "true");

            EngineConfig config = EngineConfig.load(EngineConfigTest.class.getClassLoader());

            assertThat(config.getCacheMaxSize()).isEqualTo(7);
            assertThat(config.isDebug()).isTrue();
        }

        @Test
        void invalidNumberIsRejected() {
            Properties props = new Properties();
            props.setProperty("cacheExpireMinutes", "soon");

            assertThatThrownBy(() -> EngineConfig.from(props))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jdirective.cacheExpireMinutes");
        }
    }
}
