package dev.aparikh.videosearch.model;

/**
 * How a source turns its response into results.
 */
public enum ExtractionMethod {
    /** Vendor JSON API mapped directly. */
    API,
    /** JSON object embedded in an HTML page. */
    JSON_EXTRACTION,
    /** HTML scraping, bespoke or through the generic extractor. */
    HTML
}
