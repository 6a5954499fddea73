package me.golemcore.testinsight.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ThemeTest {

    @Test
    void parseShouldBeLenient() {
        assertEquals(Theme.DARK, Theme.parse(" DARK "));
        assertNull(Theme.parse("purple"));
        assertNull(Theme.parse(null));
    }

    @Test
    void fromValueShouldRejectUnknownTheme() {
        assertThrows(IllegalArgumentException.class, () -> Theme.fromValue("purple"));
    }
}
