package uk.gegc.vidstream.features.video.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "VideoSummaryDto", description = "Catalogue entry without the playback URL")
public record VideoSummaryDto(
        UUID id,
        String title,
        String description,
        String thumbnailUrl,
        LocalDateTime createdAt
) {
}
