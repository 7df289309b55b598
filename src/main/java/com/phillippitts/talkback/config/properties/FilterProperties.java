package com.phillippitts.talkback.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "filter")
public class FilterProperties {

    /** Spring resource location of the self-speech phrase catalog. */
    private final String catalogLocation;

    /** Fragments with more words than this are treated as the assistant's own output. */
    @Min(1)
    private final int maxHumanWords;

    /** Share of a fragment's words that must appear in the playback text (0..1). */
    @Min(0)
    @Max(1)
    private final double echoOverlapThreshold;

    /** Fragments shorter than this are never matched against playback text. */
    @Min(1)
    private final int echoMinTokens;

    @ConstructorBinding
    public FilterProperties(String catalogLocation, Integer maxHumanWords,
                            Double echoOverlapThreshold, Integer echoMinTokens) {
        this.catalogLocation = (catalogLocation == null || catalogLocation.isBlank())
                ? "classpath:self-speech/catalog-v1.txt" : catalogLocation;
        this.maxHumanWords = maxHumanWords == null ? 15 : maxHumanWords;
        double t = echoOverlapThreshold == null ? 0.6 : echoOverlapThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException("filter.echo-overlap-threshold must be in [0,1]");
        }
        this.echoOverlapThreshold = t;
        this.echoMinTokens = echoMinTokens == null ? 2 : echoMinTokens;
    }

    public String getCatalogLocation() {
        return catalogLocation;
    }

    public int getMaxHumanWords() {
        return maxHumanWords;
    }

    public double getEchoOverlapThreshold() {
        return echoOverlapThreshold;
    }

    public int getEchoMinTokens() {
        return echoMinTokens;
    }
}
