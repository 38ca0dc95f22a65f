package uk.gegc.mathdrill.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for arithmetic expression generation
 */
@Component
@ConfigurationProperties(prefix = "mathdrill.generation")
@Data
public class ExpressionGenerationProperties {

    /**
     * Attempts allowed to split one node, resampling its operator after each failure
     */
    private int maxSplitAttempts = 10;

    /**
     * Largest absolute range bound accepted; also caps the shared prime table
     */
    private int maxAbsoluteBound = 1_000_000;

    /**
     * Maximum number of expressions produced by one batch request
     */
    private int maxBatchSize = 100;
}
