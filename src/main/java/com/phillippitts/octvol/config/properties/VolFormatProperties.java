package com.phillippitts.octvol.config.properties;

import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Format acceptance settings for the .vol header decoder.
 *
 * <p>Example application.properties:
 * <pre>
 * octvol.format.accepted-versions=HSF-OCT-103
 * </pre>
 *
 * <p>Note: Bean created via {@code @EnableConfigurationProperties} on {@link com.phillippitts.octvol.OctVolApplication}.
 */
@ConfigurationProperties(prefix = "octvol.format")
@Validated
public class VolFormatProperties {

    /** Version tags the header decoder accepts; any other tag is rejected as a format error. */
    @NotEmpty(message = "At least one accepted .vol version is required")
    private List<String> acceptedVersions = new ArrayList<>(List.of("HSF-OCT-103"));

    public List<String> getAcceptedVersions() {
        return acceptedVersions;
    }

    public void setAcceptedVersions(List<String> acceptedVersions) {
        this.acceptedVersions = acceptedVersions;
    }
}
