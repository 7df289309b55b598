package com.phillippitts.talkback.config.properties;

import com.phillippitts.talkback.domain.EnvironmentCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Host classification settings.
 */
@Validated
@ConfigurationProperties(prefix = "environment")
public class EnvironmentProperties {

    /** Forces a category instead of probing the host; null means probe. */
    private final EnvironmentCategory category;

    /** File holding the board model string on single-board Linux devices. */
    private final String boardModelPath;

    @ConstructorBinding
    public EnvironmentProperties(EnvironmentCategory category, String boardModelPath) {
        this.category = category;
        this.boardModelPath = (boardModelPath == null || boardModelPath.isBlank())
                ? "/proc/device-tree/model" : boardModelPath;
    }

    public EnvironmentCategory getCategory() {
        return category;
    }

    public String getBoardModelPath() {
        return boardModelPath;
    }
}
