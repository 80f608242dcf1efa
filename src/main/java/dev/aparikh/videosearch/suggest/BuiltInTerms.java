package dev.aparikh.videosearch.suggest;

import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Term, performer and popular-search tables shipped with the service.
 */
final class BuiltInTerms {

    static final String TERMS_RESOURCE = "suggestions/terms.txt";
    static final String PERFORMERS_RESOURCE = "suggestions/performers.txt";

    static final List<String> POPULAR = List.of(
            "teen", "milf", "lesbian", "anal", "amateur", "big tits",
            "blonde", "asian", "threesome", "creampie", "blowjob", "latina",
            "ebony", "hardcore", "mature", "stepmom", "japanese", "massage",
            "pov", "big ass", "interracial", "hentai", "bbc", "step sister",
            "squirt", "gangbang", "deepthroat", "rough", "pawg", "redhead",
            "solo", "femdom", "indian", "double penetration", "homemade");

    private BuiltInTerms() {
    }

    static List<String> loadTerms() {
        return read(TERMS_RESOURCE);
    }

    static List<String> loadPerformers() {
        return read(PERFORMERS_RESOURCE);
    }

    /**
     * Reads a bundled list; blank lines and {@code #} comments are skipped.
     */
    private static List<String> read(String location) {
        ClassPathResource resource = new ClassPathResource(location);
        List<String> entries = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String entry = line.trim();
                if (!entry.isEmpty() && !entry.startsWith("#")) {
                    entries.add(entry);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + location, e);
        }
        return List.copyOf(entries);
    }
}
