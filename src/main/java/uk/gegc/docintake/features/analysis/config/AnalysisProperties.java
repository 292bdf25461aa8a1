package uk.gegc.docintake.features.analysis.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "app.analysis")
public class AnalysisProperties {

    /**
     * Credential for the external analysis service. When blank, analysis returns mock results
     * and never touches the network.
     */
    private String apiKey;

    /**
     * Upper bound on one external analysis call.
     */
    @NotNull
    private Duration timeout = Duration.ofSeconds(60);

    /**
     * Simulated processing time of the mock path.
     */
    @NotNull
    private Duration mockDelay = Duration.ofMillis(1500);

    @Min(1)
    private int maxContentChars = 30000;

    public boolean isExternalServiceConfigured() {
        return StringUtils.hasText(apiKey);
    }
}
