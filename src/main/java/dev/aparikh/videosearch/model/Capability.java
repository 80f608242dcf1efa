package dev.aparikh.videosearch.model;

/**
 * Optional result fields a source declares it can populate reliably.
 */
public enum Capability {
    PREVIEW,
    DOWNLOAD,
    DURATION,
    VIEWS,
    RATING,
    QUALITY,
    UPLOAD_DATE
}
