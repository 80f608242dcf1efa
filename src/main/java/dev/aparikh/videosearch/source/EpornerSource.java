package dev.aparikh.videosearch.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.videosearch.extract.DurationParser;
import dev.aparikh.videosearch.extract.RatingParser;
import dev.aparikh.videosearch.extract.UploadDateParser;
import dev.aparikh.videosearch.extract.ViewsParser;
import dev.aparikh.videosearch.model.Capability;
import dev.aparikh.videosearch.model.ExtractionMethod;
import dev.aparikh.videosearch.model.Feature;
import dev.aparikh.videosearch.model.Result;
import dev.aparikh.videosearch.model.SourceDescriptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

/**
 * Eporner public JSON search API.
 */
class EpornerSource extends AbstractSourceAdapter {

    static final int PER_PAGE = 50;

    static final SourceDescriptor DESCRIPTOR = new SourceDescriptor(
            "eporner", "Eporner", "https://www.eporner.com", 2,
            EnumSet.of(Capability.DURATION, Capability.VIEWS, Capability.RATING, Capability.UPLOAD_DATE),
            ExtractionMethod.API, "");

    private final ObjectMapper objectMapper;

    EpornerSource(SourceFetcher fetcher, ObjectMapper objectMapper) {
        super(DESCRIPTOR, EnumSet.of(Feature.PAGINATION, Feature.SORTING), fetcher);
        this.objectMapper = objectMapper;
    }

    @Override
    protected String searchUrl(String query, int page) {
        return baseUrl() + "/api/v2/video/search/?query=" + encode(query)
                + "&per_page=" + PER_PAGE + "&page=" + page + "&thumbsize=big&order=top-rated&format=json";
    }

    @Override
    protected List<Result> parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(name(), "undecodable payload: " + e.getOriginalMessage(), e);
        }

        List<Result> results = new ArrayList<>();
        for (JsonNode video : root.path("videos")) {
            int seconds = video.path("length_sec").asInt(0);
            String display = video.path("length_min").asText("");
            long views = video.path("views").asLong(0);
            Result.Builder builder = Result.builder()
                    .source(descriptor())
                    .url(video.path("url").asText(""))
                    .title(video.path("title").asText(""))
                    .thumbnail(video.path("default_thumb").path("src").asText(""))
                    .duration(display.isBlank() ? DurationParser.format(seconds) : display, seconds)
                    .views(ViewsParser.format(views), views)
                    .rating(RatingParser.parse(video.path("rate").asText("")))
                    .uploadDate(UploadDateParser.parse(video.path("added").asText("")));
            String keywords = video.path("keywords").asText("");
            if (!keywords.isBlank()) {
                builder.tags(Arrays.asList(keywords.split(",")));
            }
            builder.build().ifPresent(results::add);
        }
        return results;
    }
}
