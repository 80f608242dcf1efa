package dev.aparikh.videosearch.model;

public enum Feature {
    PAGINATION,
    SORTING,
    FILTERING,
    THUMBNAIL_PREVIEW
}
