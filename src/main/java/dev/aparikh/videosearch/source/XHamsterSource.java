package dev.aparikh.videosearch.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.videosearch.extract.DurationParser;
import dev.aparikh.videosearch.extract.UploadDateParser;
import dev.aparikh.videosearch.extract.ViewsParser;
import dev.aparikh.videosearch.model.Capability;
import dev.aparikh.videosearch.model.ExtractionMethod;
import dev.aparikh.videosearch.model.Feature;
import dev.aparikh.videosearch.model.Result;
import dev.aparikh.videosearch.model.SourceDescriptor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * xHamster renders its results into a {@code window.initials} object inside the page;
 * results are read from {@code searchResult.videoThumbProps}.
 */
class XHamsterSource extends AbstractSourceAdapter {

    static final String INITIALS_MARKER = "window.initials=";

    static final SourceDescriptor DESCRIPTOR = new SourceDescriptor(
            "xhamster", "xHamster", "https://xhamster.com", 1,
            EnumSet.of(Capability.DURATION, Capability.VIEWS, Capability.UPLOAD_DATE),
            ExtractionMethod.JSON_EXTRACTION, "");

    private final ObjectMapper objectMapper;

    XHamsterSource(SourceFetcher fetcher, ObjectMapper objectMapper) {
        super(DESCRIPTOR, EnumSet.of(Feature.PAGINATION), fetcher);
        this.objectMapper = objectMapper;
    }

    @Override
    protected String searchUrl(String query, int page) {
        String path = baseUrl() + "/search/" + encode(query);
        return page <= 1 ? path : path + "/" + page;
    }

    @Override
    protected List<Result> parse(String body) {
        String json = JsonObjectExtractor.extractAfter(body, INITIALS_MARKER)
                .orElseThrow(() -> new SourceFetchException(name(), "initials object not found"));
        JsonNode initials;
        try {
            initials = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(name(), "undecodable initials: " + e.getOriginalMessage(), e);
        }

        List<Result> results = new ArrayList<>();
        for (JsonNode video : initials.path("searchResult").path("videoThumbProps")) {
            int seconds = video.path("duration").asInt(0);
            long views = video.path("views").asLong(0);
            Result.builder()
                    .source(descriptor())
                    .url(video.path("pageURL").asText(""))
                    .title(video.path("title").asText(""))
                    .thumbnail(video.path("thumbURL").asText(""))
                    .duration(DurationParser.format(seconds), seconds)
                    .views(views > 0 ? ViewsParser.format(views) : "", views)
                    .uploadDate(UploadDateParser.fromEpochSeconds(video.path("created").asLong(0)))
                    .build()
                    .ifPresent(results::add);
        }
        return results;
    }
}
