package dev.aparikh.videosearch.source;

import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

final class Fixtures {

    static final FetchPolicy FAST_POLICY =
            new FetchPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5), 5, Duration.ofMinutes(1), null);

    private Fixtures() {
    }

    static String load(String name) {
        try (InputStream in = new ClassPathResource("fixtures/" + name).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
