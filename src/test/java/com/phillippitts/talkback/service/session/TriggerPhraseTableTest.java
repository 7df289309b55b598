package com.phillippitts.talkback.service.session;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TriggerPhraseTableTest {

    @Test
    void shouldPreferFirstIdentityInTableOrder() {
        Map<String, List<String>> phrases = new LinkedHashMap<>();
        phrases.put("eladriel", List.of("dino"));
        phrases.put("sophia", List.of("miley"));
        TriggerPhraseTable table = new TriggerPhraseTable(phrases);

        assertThat(table.match("miley and dino")).contains("eladriel");
    }

    @Test
    void shouldMatchMultiWordPhrasesIgnoringPunctuationAndCase() {
        TriggerPhraseTable table = new TriggerPhraseTable(Map.of("parent", List.of("hey assistant")));

        assertThat(table.match("Hey, Assistant!")).contains("parent");
        assertThat(table.match("assistant hey")).isEmpty();
    }

    @Test
    void shouldReportEmptyTable() {
        assertThat(new TriggerPhraseTable(Map.of()).isEmpty()).isTrue();
        assertThat(new TriggerPhraseTable(Map.of()).match("anything")).isEmpty();
    }
}
