package com.phillippitts.bilingualtts.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Location and naming of the per-request scratch directories holding segment audio.
 */
@ConfigurationProperties(prefix = "tts.workspace")
@Validated
public class WorkspaceProperties {

    /**
     * Parent directory for workspaces. Blank means the JVM temp directory
     * ({@code java.io.tmpdir}).
     */
    private String baseDir = "";

    /** Directory name prefix of each workspace. */
    @NotBlank
    private String prefix = "tts_";

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }
}
