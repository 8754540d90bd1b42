package com.cgi.dbconnector.core.artifact;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-call options for {@link ArtifactManager#fetchDrivers}.
 */
@Getter
@Builder
@ToString
public class DownloadOptions {
    /**
     * Transport to use.
     */
    @Builder.Default
    private final DownloadMethod method = DownloadMethod.AUTO;

    /**
     * Policy for jars left from an earlier install; null uses the configured policy.
     */
    private final PriorArtifactPolicy priorArtifactPolicy;

    public static DownloadOptions defaults() {
        return DownloadOptions.builder().build();
    }
}
