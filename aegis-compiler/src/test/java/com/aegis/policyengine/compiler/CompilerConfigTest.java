package com.aegis.policyengine.compiler;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompilerConfigTest {

    @Test
    void defaults() {
        CompilerConfig config = CompilerConfig.defaults();

        assertThat(config.quantifierCompilation()).isFalse();
        assertThat(config.patternCacheSize()).isEqualTo(1024);
    }

    @Test
    void loadsFromClasspathProperties() throws IOException {
        CompilerConfig config = CompilerConfig.loadFromProperties("aegis-test.properties");

        assertThat(config.quantifierCompilation()).isTrue();
        assertThat(config.patternCacheSize()).isEqualTo(64);
    }

    @Test
    void missingPropertiesFileFails() {
        assertThatThrownBy(() -> CompilerConfig.loadFromProperties("does-not-exist.properties"))
                .isInstanceOf(IOException.class);
    }

    @Test
    void rejectsNonPositivePatternCache() {
        assertThatThrownBy(() -> CompilerConfig.builder().patternCacheSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
