package com.phillippitts.talkback.config;

import com.phillippitts.talkback.config.properties.AssemblerProperties;
import com.phillippitts.talkback.config.properties.EnvironmentProperties;
import com.phillippitts.talkback.config.properties.FilterProperties;
import com.phillippitts.talkback.config.properties.ListenProperties;
import com.phillippitts.talkback.config.properties.SessionProperties;
import com.phillippitts.talkback.service.assembly.LexicalRepairTable;
import com.phillippitts.talkback.service.capture.IncompleteUtteranceDetector;
import com.phillippitts.talkback.service.filter.SelfSpeechCatalog;
import com.phillippitts.talkback.service.filter.SelfSpeechCatalogLoader;
import com.phillippitts.talkback.service.profile.EnvironmentProfileResolver;
import com.phillippitts.talkback.service.profile.SystemEnvironmentProbe;
import com.phillippitts.talkback.service.session.TriggerPhraseTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the configuration-driven collaborators of the capture pipeline: phrase tables, the
 * self-speech catalog and the environment profile resolver.
 */
@Configuration
public class VoicePipelineConfig {

    private static final Logger LOG = LogManager.getLogger(VoicePipelineConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EnvironmentProfileResolver environmentProfileResolver(EnvironmentProperties props) {
        return new EnvironmentProfileResolver(new SystemEnvironmentProbe(Path.of(props.getBoardModelPath())), props);
    }

    /**
     * Self-speech catalog. Fails startup when the configured catalog is missing.
     */
    @Bean
    public SelfSpeechCatalog selfSpeechCatalog(ResourceLoader resourceLoader, FilterProperties props) {
        return new SelfSpeechCatalogLoader(resourceLoader).load(props.getCatalogLocation());
    }

    @Bean
    public LexicalRepairTable lexicalRepairTable(AssemblerProperties props) {
        return new LexicalRepairTable(props.repairs());
    }

    @Bean
    public IncompleteUtteranceDetector incompleteUtteranceDetector(ListenProperties props) {
        IncompleteUtteranceDetector detector = new IncompleteUtteranceDetector(props.openersForLocale());
        if (detector.size() == 0) {
            LOG.warn("No incomplete-sentence openers configured for locale '{}'", props.getLocale());
        }
        return detector;
    }

    @Bean
    public TriggerPhraseTable triggerPhraseTable(SessionProperties props) {
        TriggerPhraseTable table = new TriggerPhraseTable(props.getTriggers());
        if (table.isEmpty()) {
            LOG.warn("No trigger phrases configured; no conversation session can start");
        }
        return table;
    }
}
