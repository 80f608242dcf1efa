package dev.aparikh.videosearch.source;

/**
 * Unrecoverable failure fetching or decoding a source's search page.
 */
public class SourceFetchException extends RuntimeException {

    private final String source;

    public SourceFetchException(String source, String message) {
        super(message);
        this.source = source;
    }

    public SourceFetchException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
