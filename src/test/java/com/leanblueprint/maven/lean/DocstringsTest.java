package com.leanblueprint.maven.lean;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class DocstringsTest {

    @Test
    void makeDocstring_singleLine() {
        assertThat(Docstrings.makeDocstring("  A widget.\n")).isEqualTo("/-- A widget. -/");
    }

    @Test
    void makeDocstring_multiLineIndented() {
        assertThat(Docstrings.makeDocstring("First.\n\nSecond.", 2))
                .isEqualTo("/--\n  First.\n  \n  Second.\n  -/");
    }

    @Test
    void quote_escapesQuotesBackslashesAndNewlines() {
        assertThat(Docstrings.quote("a\"b\\c\n")).isEqualTo("\"a\\\"b\\\\c\\n\"");
    }

    @Test
    void quote_keepsNonAscii() {
        assertThat(Docstrings.quote("Gödel ∀")).isEqualTo("\"Gödel ∀\"");
    }
}
