package dev.aparikh.videosearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Hot reload of search and suggestion settings from an external YAML file.
 */
@Validated
@ConfigurationProperties(prefix = "videosearch.reload")
class ReloadProperties {

    private Path file; // unset = no file is watched

    Path getFile() {
        return file;
    }

    void setFile(Path file) {
        this.file = file;
    }
}
