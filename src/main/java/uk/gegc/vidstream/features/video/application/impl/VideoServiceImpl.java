package uk.gegc.vidstream.features.video.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.vidstream.features.video.api.dto.CreateVideoRequest;
import uk.gegc.vidstream.features.video.api.dto.VideoDetailDto;
import uk.gegc.vidstream.features.video.api.dto.VideoSummaryDto;
import uk.gegc.vidstream.features.video.application.VideoService;
import uk.gegc.vidstream.features.video.domain.model.Video;
import uk.gegc.vidstream.features.video.domain.repository.VideoRepository;
import uk.gegc.vidstream.features.video.infra.mapping.VideoMapper;
import uk.gegc.vidstream.shared.exception.ResourceNotFoundException;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class VideoServiceImpl implements VideoService {

    private final VideoRepository videoRepository;
    private final VideoMapper videoMapper;

    @Override
    @Transactional(readOnly = true)
    public Page<VideoSummaryDto> listVideos(Pageable pageable) {
        return videoRepository.findAllByOrderByCreatedAtDesc(pageable).map(videoMapper::toSummary);
    }

    @Override
    @Transactional(readOnly = true)
    public VideoDetailDto getVideo(UUID videoId) {
        return videoRepository.findById(videoId)
                .map(videoMapper::toDetail)
                .orElseThrow(() -> new ResourceNotFoundException("Video " + videoId + " not found"));
    }

    @Override
    @Transactional
    public VideoDetailDto createVideo(CreateVideoRequest request) {
        Video saved = videoRepository.save(videoMapper.toEntity(request));
        log.info("Added video {} '{}'", saved.getId(), saved.getTitle());
        return videoMapper.toDetail(saved);
    }
}
