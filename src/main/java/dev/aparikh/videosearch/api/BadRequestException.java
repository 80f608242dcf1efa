package dev.aparikh.videosearch.api;

/**
 * Client error reported as HTTP 400 with a specific error code.
 */
public class BadRequestException extends RuntimeException {

    public static final String MISSING_QUERY = "MISSING_QUERY";
    public static final String EMPTY_QUERY = "EMPTY_QUERY";

    private final String code;

    public BadRequestException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
