package uk.gegc.vidstream.features.video.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.vidstream.features.video.api.dto.CreateVideoRequest;
import uk.gegc.vidstream.features.video.api.dto.VideoDetailDto;
import uk.gegc.vidstream.features.video.api.dto.VideoSummaryDto;
import uk.gegc.vidstream.features.video.domain.model.Video;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface VideoMapper {

    VideoSummaryDto toSummary(Video video);

    VideoDetailDto toDetail(Video video);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    Video toEntity(CreateVideoRequest request);
}
