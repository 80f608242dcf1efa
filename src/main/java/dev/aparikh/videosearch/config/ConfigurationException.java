package dev.aparikh.videosearch.config;

/**
 * Invalid configuration detected at startup or on reload.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
