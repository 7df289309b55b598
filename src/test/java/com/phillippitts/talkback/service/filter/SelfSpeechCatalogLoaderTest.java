package com.phillippitts.talkback.service.filter;

import com.phillippitts.talkback.exception.SelfSpeechCatalogException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelfSpeechCatalogLoaderTest {

    @Test
    void shouldParseVersionAndSkipCommentsBlanksAndDuplicates() throws Exception {
        String text = """
                # Phrases the assistant says
                # version: 2

                Great Job
                great job
                  I'm listening\s
                """;

        SelfSpeechCatalog catalog = SelfSpeechCatalogLoader.parse(new StringReader(text));

        assertThat(catalog.version()).isEqualTo("2");
        assertThat(catalog.phrases()).containsExactly("great job", "i'm listening");
    }

    @Test
    void shouldDefaultVersionWhenHeaderMissing() throws Exception {
        SelfSpeechCatalog catalog = SelfSpeechCatalogLoader.parse(new StringReader("wonderful\n"));

        assertThat(catalog.version()).isEqualTo("unversioned");
        assertThat(catalog.firstMatch("That is WONDERFUL news")).isEqualTo("wonderful");
        assertThat(catalog.firstMatch("hello")).isNull();
    }

    @Test
    void shouldLoadBundledCatalog() {
        SelfSpeechCatalogLoader loader = new SelfSpeechCatalogLoader(new DefaultResourceLoader());

        SelfSpeechCatalog catalog = loader.load("classpath:self-speech/catalog-v1.txt");

        assertThat(catalog.version()).isEqualTo("1");
        assertThat(catalog.phrases()).contains("i'm listening", "how far is what");
    }

    @Test
    void shouldFailWhenCatalogIsMissing() {
        SelfSpeechCatalogLoader loader = new SelfSpeechCatalogLoader(new DefaultResourceLoader());

        assertThatThrownBy(() -> loader.load("classpath:self-speech/missing.txt"))
                .isInstanceOf(SelfSpeechCatalogException.class)
                .hasMessageContaining("missing.txt");
    }
}
