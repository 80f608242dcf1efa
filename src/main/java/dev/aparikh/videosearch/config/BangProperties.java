package dev.aparikh.videosearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extra bang aliases, alias to source name.
 */
@Validated
@ConfigurationProperties(prefix = "videosearch.bangs")
class BangProperties {

    private Map<String, String> custom = new LinkedHashMap<>();

    Map<String, String> getCustom() {
        return custom;
    }

    void setCustom(Map<String, String> custom) {
        this.custom = custom;
    }
}
