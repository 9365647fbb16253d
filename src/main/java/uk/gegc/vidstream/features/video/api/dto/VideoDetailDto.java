package uk.gegc.vidstream.features.video.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "VideoDetailDto", description = "Full video entry including the playback URL; subscribers only")
public record VideoDetailDto(
        UUID id,
        String title,
        String description,
        String thumbnailUrl,
        @Schema(description = "Playback URL on the video host", example = "https://player.vimeo.com/video/76979871")
        String videoUrl,
        String videoHostId,
        LocalDateTime createdAt
) {
}
