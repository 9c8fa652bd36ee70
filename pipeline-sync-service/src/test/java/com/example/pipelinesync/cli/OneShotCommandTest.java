package com.example.pipelinesync.cli;

import com.example.pipelinesync.entity.SyncMode;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OneShotCommandTest {

    @Test
    void parsesAllOptions() {
        OneShotCommand command = parse("--run=jobs", "--mode=FULL", "--lookback=P14D", "--dry-run");

        assertThat(command.target()).isEqualTo("jobs");
        assertThat(command.mode()).isEqualTo(SyncMode.FULL);
        assertThat(command.lookback()).isEqualTo(Duration.ofDays(14));
        assertThat(command.dryRun()).isTrue();
    }

    @Test
    void defaultsToIncrementalWithoutLookback() {
        OneShotCommand command = parse("--run=stage-transitions");

        assertThat(command.mode()).isEqualTo(SyncMode.INCREMENTAL);
        assertThat(command.lookback()).isNull();
        assertThat(command.dryRun()).isFalse();
    }

    @Test
    void rejectsMalformedOptions() {
        assertThatThrownBy(() -> parse("--mode=full"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--run");
        assertThatThrownBy(() -> parse("--run=jobs", "--mode=partial"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("partial");
        assertThatThrownBy(() -> parse("--run=jobs", "--lookback=14 days"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("ISO-8601");
        assertThatThrownBy(() -> parse("--run=jobs", "--lookback=-P1D"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("positive");
        assertThatThrownBy(() -> parse("--run=jobs", "--run=estimates"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("more than once");
    }

    @Test
    void detectsOneShotInvocation() {
        assertThat(OneShotCommand.isOneShot(new String[]{"--spring.profiles.active=dev", "--run=all"})).isTrue();
        assertThat(OneShotCommand.isOneShot(new String[]{"--server.port=9000"})).isFalse();
        assertThat(OneShotCommand.isOneShot(new String[0])).isFalse();
    }

    private static OneShotCommand parse(String... args) {
        return OneShotCommand.parse(new DefaultApplicationArguments(args));
    }
}
