package dev.aparikh.videosearch.config;

import org.springframework.context.ApplicationEvent;

/**
 * Published when the environment holds new {@code videosearch.search} or
 * {@code videosearch.suggestions} values that should replace the active ones.
 */
public class SettingsReloadEvent extends ApplicationEvent {

    public SettingsReloadEvent(Object source) {
        super(source);
    }
}
