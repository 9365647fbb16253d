package uk.gegc.vidstream.features.video.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import uk.gegc.vidstream.features.video.api.dto.CreateVideoRequest;
import uk.gegc.vidstream.features.video.api.dto.VideoDetailDto;
import uk.gegc.vidstream.features.video.api.dto.VideoSummaryDto;
import uk.gegc.vidstream.features.video.application.VideoService;
import uk.gegc.vidstream.shared.security.annotation.RequireActiveSubscription;

import java.util.UUID;

@Tag(name = "Videos", description = "Video catalogue; playback requires an active subscription")
@RestController
@RequestMapping("/api/v1/videos")
@RequiredArgsConstructor
public class VideoController {

    private final VideoService videoService;

    @Operation(summary = "Browse the catalogue", description = "Newest first. Playback URLs are not included.")
    @GetMapping
    public ResponseEntity<Page<VideoSummaryDto>> listVideos(@PageableDefault(size = 20) Pageable pageable) {
        return ResponseEntity.ok(videoService.listVideos(pageable));
    }

    @Operation(summary = "Get a video for playback")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Video with playback URL"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid token",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "No active subscription",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Video not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{videoId}")
    @RequireActiveSubscription
    public ResponseEntity<VideoDetailDto> getVideo(@PathVariable UUID videoId) {
        return ResponseEntity.ok(videoService.getVideo(videoId));
    }

    @Operation(summary = "Add a video (admin)")
    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<VideoDetailDto> createVideo(@Valid @RequestBody CreateVideoRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(videoService.createVideo(request));
    }
}
