package com.cgi.dbconnector.api.dto;

import com.cgi.dbconnector.core.artifact.DownloadMethod;
import com.cgi.dbconnector.core.artifact.DownloadOptions;
import com.cgi.dbconnector.core.artifact.StandardPriorArtifactPolicy;
import lombok.Data;

/**
 * DTO for driver download requests.
 */
@Data
public class DownloadRequest {
    /**
     * DBMS key, alias or "all".
     */
    private String dbms;

    /**
     * Target folder. Falls back to DATABASECONNECTOR_JAR_FOLDER when absent.
     */
    private String pathToDriver;

    /**
     * Download transport.
     */
    private DownloadMethod method;

    /**
     * What to do with jars from an earlier install; absent uses the configured policy.
     */
    private StandardPriorArtifactPolicy priorArtifacts;

    /**
     * Converts this request to download options.
     *
     * @return Download options
     */
    public DownloadOptions toOptions() {
        return DownloadOptions.builder()
                .method(method != null ? method : DownloadMethod.AUTO)
                .priorArtifactPolicy(priorArtifacts)
                .build();
    }
}
