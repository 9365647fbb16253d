package uk.gegc.vidstream.features.video.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.vidstream.features.video.api.dto.CreateVideoRequest;
import uk.gegc.vidstream.features.video.api.dto.VideoDetailDto;
import uk.gegc.vidstream.features.video.api.dto.VideoSummaryDto;

import java.util.UUID;

public interface VideoService {

    Page<VideoSummaryDto> listVideos(Pageable pageable);

    VideoDetailDto getVideo(UUID videoId);

    VideoDetailDto createVideo(CreateVideoRequest request);
}
