package com.tooldigest.research.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    @ParameterizedTest
    @ValueSource(strings = {"https://aider.chat", "http://example.com/path?q=1"})
    @DisplayName("Accepts absolute http(s) URLs")
    void acceptsHttpUrls(String url) {
        assertThat(UrlNormalizer.isAbsoluteHttpUrl(url)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "aider.chat", "/relative/path", "ftp://example.com", "https://", "not a url"})
    @DisplayName("Rejects relative, non-http and malformed URLs")
    void rejectsOtherUrls(String url) {
        assertThat(UrlNormalizer.isAbsoluteHttpUrl(url)).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
            "https://GitHub.com/Paul-Gauthier/Aider/, https://github.com/paul-gauthier/aider",
            "https://cursor.com/?ref=hn#pricing, https://cursor.com",
            "HTTP://Example.com/a/b//, http://example.com/a/b"
    })
    @DisplayName("Normalizes case, trailing slashes, query and fragment")
    void normalizesForKey(String url, String expected) {
        assertThat(UrlNormalizer.normalizeForKey(url)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Invalid URLs normalize to an empty key")
    void invalidUrlHasEmptyKey() {
        assertThat(UrlNormalizer.normalizeForKey(null)).isEmpty();
        assertThat(UrlNormalizer.normalizeForKey("tool-site")).isEmpty();
    }

    @Test
    @DisplayName("hostOf strips the www prefix")
    void hostOfStripsWww() {
        assertThat(UrlNormalizer.hostOf("https://www.reddit.com/r/programming")).isEqualTo("reddit.com");
        assertThat(UrlNormalizer.hostOf("nope")).isNull();
    }
}
