package com.yoursp.filestorage.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds the {@code filestorage.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "filestorage")
public class FileStorageProperties {

    private Local local = new Local();

    /** Settings for the local filesystem adapter. */
    @Getter
    @Setter
    public static class Local {
        private String root = "/tmp/filestorage";
    }
}
