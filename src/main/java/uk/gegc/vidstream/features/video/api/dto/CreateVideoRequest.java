package uk.gegc.vidstream.features.video.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "CreateVideoRequest", description = "Registers a video already uploaded to the video host")
public record CreateVideoRequest(
        @Schema(example = "Intro to Chichewa")
        @NotBlank(message = "{video.title.blank}")
        @Size(max = 100, message = "{video.title.max}")
        String title,

        @Size(max = 2000, message = "{video.description.max}")
        String description,

        @Size(max = 512, message = "{video.url.max}")
        String thumbnailUrl,

        @NotBlank(message = "{video.url.blank}")
        @Size(max = 512, message = "{video.url.max}")
        String videoUrl,

        @Size(max = 64, message = "{video.hostId.max}")
        String videoHostId
) {
}
