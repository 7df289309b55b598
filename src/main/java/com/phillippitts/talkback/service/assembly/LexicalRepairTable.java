package com.phillippitts.talkback.service.assembly;

import com.phillippitts.talkback.config.properties.AssemblerProperties;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Ordered literal substitutions for common mis-transcriptions.
 *
 * <p>Replacements apply in table order to lower-cased text, each to the output of the previous.
 */
public final class LexicalRepairTable {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<AssemblerProperties.Repair> repairs;

    public LexicalRepairTable(List<AssemblerProperties.Repair> repairs) {
        this.repairs = List.copyOf(repairs);
    }

    /**
     * Lower-cases {@code text}, applies every repair and collapses whitespace.
     *
     * @param text assembled transcript
     * @return cleaned transcript, empty for null input
     */
    public String apply(String text) {
        if (text == null) {
            return "";
        }
        String result = collapse(text.toLowerCase(Locale.ROOT));
        for (AssemblerProperties.Repair repair : repairs) {
            String from = repair.from().toLowerCase(Locale.ROOT);
            result = result.replace(from, repair.to().toLowerCase(Locale.ROOT));
        }
        return collapse(result);
    }

    public int size() {
        return repairs.size();
    }

    static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
