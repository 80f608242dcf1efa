package dev.aparikh.videosearch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Optional rewrite of thumbnail and preview URLs through a proxy endpoint.
 */
@Validated
@ConfigurationProperties(prefix = "videosearch.thumbnails")
class ThumbnailProperties {

    private String proxyPrefix; // blank = URLs are returned unchanged

    String getProxyPrefix() {
        return proxyPrefix;
    }

    void setProxyPrefix(String proxyPrefix) {
        this.proxyPrefix = proxyPrefix;
    }
}
