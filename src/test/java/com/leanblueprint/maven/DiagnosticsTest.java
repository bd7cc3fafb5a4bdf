package com.leanblueprint.maven;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DiagnosticsTest {

    @Mock
    private Log log;

    @Test
    void warn_forwardsToLogAndCollects() {
        Diagnostics diagnostics = new Diagnostics(log);

        diagnostics.warn("one");
        diagnostics.warn("one");

        verify(log, times(2)).warn("one");
        assertThat(diagnostics.getWarnings()).containsExactly("one", "one");
    }

    @Test
    void warnOnce_latchesPerKey() {
        Diagnostics diagnostics = new Diagnostics(log);

        assertThat(diagnostics.warnOnce("k", "first")).isTrue();
        assertThat(diagnostics.warnOnce("k", "second")).isFalse();
        assertThat(diagnostics.warnOnce("other", "third")).isTrue();

        assertThat(diagnostics.getWarnings()).containsExactly("first", "third");
    }

    @Test
    void latchIsScopedToOneCollector() {
        new Diagnostics(log).warnOnce("k", "a");

        assertThat(new Diagnostics(log).warnOnce("k", "b")).isTrue();
    }
}
