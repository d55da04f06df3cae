package io.minterm.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClassifierConfigurationTest {

    @Test
    void shouldCreateConfigurationWithDefaults() {
        ClassifierConfiguration config = ClassifierConfiguration.builder().build();

        assertThat(config.asciiTableEnabled()).isTrue();
        assertThat(config.validateRanges()).isTrue();
    }

    @Test
    void shouldCreateConfigurationWithCustomValues() {
        ClassifierConfiguration config = ClassifierConfiguration.builder()
                .asciiTableEnabled(false)
                .validateRanges(false)
                .build();

        assertThat(config.asciiTableEnabled()).isFalse();
        assertThat(config.validateRanges()).isFalse();
    }

    @Test
    void shouldShareDefaultInstance() {
        assertThat(ClassifierConfiguration.defaults()).isSameAs(ClassifierConfiguration.defaults());
        assertThat(ClassifierConfiguration.defaults().asciiTableEnabled()).isTrue();
        assertThat(ClassifierConfiguration.defaults().validateRanges()).isTrue();
    }

    @Test
    void shouldDescribeOptions() {
        assertThat(ClassifierConfiguration.builder().asciiTableEnabled(false).build())
                .hasToString("ClassifierConfiguration{asciiTableEnabled=false, validateRanges=true}");
    }
}
