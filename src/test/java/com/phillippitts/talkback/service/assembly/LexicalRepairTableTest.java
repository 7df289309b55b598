package com.phillippitts.talkback.service.assembly;

import com.phillippitts.talkback.config.properties.AssemblerProperties.Repair;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LexicalRepairTableTest {

    @Test
    void shouldApplySubstitutionsInOrder() {
        LexicalRepairTable table = new LexicalRepairTable(List.of(
                new Repair("tagalog", "filipino"),
                new Repair("filipino filipino", "filipino")));

        assertThat(table.apply("Tagalog  Filipino")).isEqualTo("filipino");
    }

    @Test
    void shouldCollapseWhitespaceWithoutRepairs() {
        LexicalRepairTable table = new LexicalRepairTable(List.of());

        assertThat(table.apply("  What\tIS \n this ")).isEqualTo("what is this");
        assertThat(table.size()).isZero();
    }

    @Test
    void shouldAllowRemovingText() {
        LexicalRepairTable table = new LexicalRepairTable(List.of(new Repair("um", null)));

        assertThat(table.apply("I um like it")).isEqualTo("i like it");
    }
}
