package com.phillippitts.talkback.service.filter;

import com.phillippitts.talkback.exception.SelfSpeechCatalogException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads a {@link SelfSpeechCatalog} from a Spring resource.
 *
 * <p>Format: one phrase per line, blank lines ignored, {@code #} starts a comment line.
 * A {@code # version: N} comment sets the catalog version.
 */
public final class SelfSpeechCatalogLoader {

    private static final Logger LOG = LogManager.getLogger(SelfSpeechCatalogLoader.class);
    private static final String VERSION_PREFIX = "# version:";

    private final ResourceLoader resourceLoader;

    public SelfSpeechCatalogLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * Loads the catalog at {@code location}.
     *
     * @param location Spring resource location, e.g. {@code classpath:self-speech/catalog-v1.txt}
     * @return parsed catalog
     * @throws SelfSpeechCatalogException if the resource does not exist or cannot be read
     */
    public SelfSpeechCatalog load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new SelfSpeechCatalogException(location);
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            SelfSpeechCatalog catalog = parse(reader);
            LOG.info("Self-speech catalog loaded: location={}, version={}, phrases={}",
                    location, catalog.version(), catalog.phrases().size());
            return catalog;
        } catch (IOException e) {
            throw new SelfSpeechCatalogException(location, e);
        }
    }

    static SelfSpeechCatalog parse(Reader reader) throws IOException {
        String version = "unversioned";
        List<String> phrases = new ArrayList<>();
        BufferedReader br = new BufferedReader(reader);
        String line;
        while ((line = br.readLine()) != null) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.startsWith("#")) {
                if (trimmed.toLowerCase(Locale.ROOT).startsWith(VERSION_PREFIX)) {
                    version = trimmed.substring(VERSION_PREFIX.length()).strip();
                }
                continue;
            }
            String phrase = trimmed.toLowerCase(Locale.ROOT);
            if (!phrases.contains(phrase)) {
                phrases.add(phrase);
            }
        }
        return new SelfSpeechCatalog(version, phrases);
    }
}
