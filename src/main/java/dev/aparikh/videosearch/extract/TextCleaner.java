package dev.aparikh.videosearch.extract;

import java.util.regex.Pattern;

public final class TextCleaner {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextCleaner() {
    }

    /**
     * Trims the text and collapses runs of whitespace (including non-breaking spaces) to one space.
     */
    public static String clean(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text.replace('\u00A0', ' ')).replaceAll(" ").trim();
    }
}
