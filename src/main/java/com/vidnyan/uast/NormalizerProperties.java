package com.vidnyan.uast;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the normalizer.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "uast.normalizer")
public class NormalizerProperties {

    /**
     * Where JSON rule tables are loaded from.
     */
    private String rulesLocation = "classpath*:rules/*.json";

    /**
     * Run position resolution after annotation.
     */
    private boolean resolvePositions = true;

    /**
     * Log every position warning at WARN level, in addition to returning it.
     */
    private boolean logPositionWarnings = false;
}
