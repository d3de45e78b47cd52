package com.profile.matching.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class BackendModeTest {

    @ParameterizedTest
    @CsvSource({
            "auto, AUTO",
            "AUTO, AUTO",
            "ollama, PRIMARY",
            "primary, PRIMARY",
            "hf, SECONDARY",
            "HuggingFace, SECONDARY",
            "secondary, SECONDARY",
            "none, NONE",
            "' off ', NONE"
    })
    @DisplayName("Parses names and aliases case-insensitively")
    void parses(String value, BackendMode expected) {
        assertEquals(expected, BackendMode.parse(value));
    }

    @Test
    @DisplayName("Missing value defaults to AUTO")
    void defaultsToAuto() {
        assertEquals(BackendMode.AUTO, BackendMode.parse(null));
        assertEquals(BackendMode.AUTO, BackendMode.parse("  "));
    }

    @Test
    @DisplayName("Unknown value is rejected")
    void unknown() {
        assertThrows(IllegalArgumentException.class, () -> BackendMode.parse("openai"));
    }
}
