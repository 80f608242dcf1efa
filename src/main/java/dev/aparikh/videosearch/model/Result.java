package dev.aparikh.videosearch.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized video result that every source maps into.
 * Title and url are always non-blank; use {@link #builder()} to create instances.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Result(
        String id,
        String title,
        String url,
        String thumbnail,
        String previewUrl,
        String downloadUrl,
        String duration,
        int durationSeconds,
        String views,
        long viewsCount,
        Double rating,
        Instant uploadDate,
        String quality,
        List<String> tags,
        String performer,
        String source,
        String sourceDisplay
) {
    public static final int MIN_TAG_LENGTH = 2;
    public static final int MAX_TAG_LENGTH = 49;

    public Result {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Stable identifier for a result: the first 8 bytes of SHA-256 over url and source name, hex encoded.
     */
    public static String generateId(String url, String source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((url + source).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public Result withMedia(String newThumbnail, String newPreviewUrl) {
        return new Result(id, title, url, newThumbnail, newPreviewUrl, downloadUrl, duration, durationSeconds,
                views, viewsCount, rating, uploadDate, quality, tags, performer, source, sourceDisplay);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String title;
        private String url;
        private String thumbnail;
        private String previewUrl;
        private String downloadUrl;
        private String duration;
        private int durationSeconds;
        private String views;
        private long viewsCount;
        private Double rating;
        private Instant uploadDate;
        private String quality;
        private final Set<String> tags = new LinkedHashSet<>();
        private String performer;
        private String source;
        private String sourceDisplay;

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder thumbnail(String thumbnail) {
            this.thumbnail = emptyToNull(thumbnail);
            return this;
        }

        public Builder previewUrl(String previewUrl) {
            this.previewUrl = emptyToNull(previewUrl);
            return this;
        }

        public Builder downloadUrl(String downloadUrl) {
            this.downloadUrl = emptyToNull(downloadUrl);
            return this;
        }

        public Builder duration(String duration, int durationSeconds) {
            this.duration = emptyToNull(duration);
            this.durationSeconds = Math.max(0, durationSeconds);
            return this;
        }

        public Builder views(String views, long viewsCount) {
            this.views = emptyToNull(views);
            this.viewsCount = Math.max(0, viewsCount);
            return this;
        }

        public Builder rating(double rating) {
            this.rating = rating > 0 ? rating : null;
            return this;
        }

        public Builder uploadDate(Instant uploadDate) {
            this.uploadDate = uploadDate;
            return this;
        }

        public Builder quality(String quality) {
            this.quality = emptyToNull(quality);
            return this;
        }

        public Builder tag(String tag) {
            if (tag == null) return this;
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            if (normalized.length() >= MIN_TAG_LENGTH && normalized.length() <= MAX_TAG_LENGTH) {
                tags.add(normalized);
            }
            return this;
        }

        public Builder tags(List<String> values) {
            if (values != null) values.forEach(this::tag);
            return this;
        }

        public Builder performer(String performer) {
            this.performer = emptyToNull(performer);
            return this;
        }

        public Builder source(SourceDescriptor descriptor) {
            this.source = descriptor.name();
            this.sourceDisplay = descriptor.displayName();
            return this;
        }

        /**
         * Builds the result, or returns empty when title or url is missing.
         */
        public Optional<Result> build() {
            String cleanTitle = title == null ? null : title.trim();
            String cleanUrl = url == null ? null : url.trim();
            if (cleanTitle == null || cleanTitle.isEmpty() || cleanUrl == null || cleanUrl.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new Result(
                    generateId(cleanUrl, source),
                    cleanTitle, cleanUrl, thumbnail, previewUrl, downloadUrl,
                    duration, durationSeconds, views, viewsCount, rating, uploadDate, quality,
                    new ArrayList<>(tags), performer, source, sourceDisplay
            ));
        }

        private static String emptyToNull(String value) {
            return value == null || value.isBlank() ? null : value.trim();
        }
    }
}
