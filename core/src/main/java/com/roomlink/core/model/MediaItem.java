package com.roomlink.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * Video carried by {@code yut_play}, {@code yut_pause}, {@code yut_stop} and playlist replies.
 */
@Value
@Builder
public class MediaItem {
    String videoId;
    String title;
    double duration;
    double offset;

    /**
     * True when the server replays the current video state to a joining client
     * rather than reporting a user action.
     */
    boolean response;

    public static MediaItem fromWire(JsonNode item, boolean response) {
        return MediaItem.builder()
                .videoId(item.path("id").asText(""))
                .title(item.path("title").asText(""))
                .duration(item.path("duration").asDouble(0))
                .offset(item.path("offset").asDouble(0))
                .response(response)
                .build();
    }
}
