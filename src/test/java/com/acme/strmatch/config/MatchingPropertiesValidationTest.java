package com.acme.strmatch.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.boot.context.properties.ConfigurationPropertiesBindException;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Out-of-range matching settings stop the context from starting.
 */
public class MatchingPropertiesValidationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(MatchingConfig.class);

    @Test
    void validSettingsBind() {
        runner.withPropertyValues(
                        "strmatch.matching.id-column=SampleID",
                        "strmatch.matching.min-shard-size=1",
                        "strmatch.matching.query-concurrency=1")
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    MatchingProperties props = ctx.getBean(MatchingProperties.class);
                    assertThat(props.getIdColumn()).isEqualTo("SampleID");
                    assertThat(props.getMinShardSize()).isEqualTo(1);
                    assertThat(props.isPrefilterEnabled()).isTrue();
                });
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "strmatch.matching.min-shard-size=0",
            "strmatch.matching.query-concurrency=0",
            "strmatch.matching.scan-threads=-1",
            "strmatch.matching.id-column= "
    })
    void invalidSettingFailsStartup(String setting) {
        runner.withPropertyValues(setting)
                .run(ctx -> {
                    assertThat(ctx).hasFailed();
                    Throwable failure = ctx.getStartupFailure();
                    assertThat(causeOfType(failure, ConfigurationPropertiesBindException.class))
                            .as("bind failure for %s", setting)
                            .isTrue();
                    assertThat(failure).hasRootCauseInstanceOf(BindValidationException.class);
                });
    }

    private static boolean causeOfType(Throwable t, Class<? extends Throwable> type) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (type.isInstance(c)) {
                return true;
            }
        }
        return false;
    }
}
