package sk.pcola.dedup.export;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlEscaperTest {

    @Test
    void shouldDoubleQuotes() {
        assertEquals("O''Brien", SqlEscaper.escape("O'Brien"));
    }

    @Test
    void shouldDoubleBackslashes() {
        assertEquals("C:\\\\dir", SqlEscaper.escape("C:\\dir"));
    }

    @Test
    void shouldEscapeBackslashBeforeQuote() {
        // \' -> \\''
        assertEquals("\\\\''", SqlEscaper.escape("\\'"));
    }

    @Test
    void shouldHandleNull() {
        assertEquals("", SqlEscaper.escape(null));
    }
}
