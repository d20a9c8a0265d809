package io.ticketforge.client;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class TextSanitizerTest {

    @Test
    void normalisesQuotesEscapesAndWhitespace() {
        Assertions.assertEquals("It's \"done\"", TextSanitizer.singleLine("It\u2019s \u201cdone\u201d\u00a0"));
        Assertions.assertEquals("line one\nline two", TextSanitizer.multiline("\"line one\\nline two  \""));
        Assertions.assertEquals("a b c", TextSanitizer.singleLine(" a  b\n\tc "));
        Assertions.assertEquals("a\n\nb", TextSanitizer.multiline("a\r\n\r\n\r\n\r\nb"));
        Assertions.assertEquals("clean", TextSanitizer.multiline("''clean''"));
        Assertions.assertEquals("", TextSanitizer.multiline(null));
    }

    @Test
    void keysLoseWhitespaceAndTrailingPunctuation() {
        Assertions.assertEquals("MIG-12", TextSanitizer.key(" MIG-12.; "));
        Assertions.assertEquals("ABC", TextSanitizer.key("A B C"));
    }

    @Test
    void bulletsOnlyWhenMultiLine() {
        Assertions.assertEquals("single", TextSanitizer.bullets("single"));
        Assertions.assertEquals("* one\n* two", TextSanitizer.bullets("one\n\ntwo"));
        Assertions.assertEquals("- one\n* two", TextSanitizer.bullets("- one\n* two"));
    }

    @Test
    void baseUrlIsNormalised() {
        Assertions.assertEquals("https://example.atlassian.net", TextSanitizer.baseUrl("example.atlassian.net/"));
        Assertions.assertEquals("https://example.atlassian.net", TextSanitizer.baseUrl("https://example.atlassian.net/rest/api/3/"));
        Assertions.assertEquals("http://127.0.0.1:8080", TextSanitizer.baseUrl("http://127.0.0.1:8080/rest/api/2"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TextSanitizer.baseUrl("  "));
    }
}
