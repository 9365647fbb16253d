package uk.gegc.vidstream.features.user.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.vidstream.features.user.api.dto.UserDto;
import uk.gegc.vidstream.features.user.domain.model.User;

@Component
public class UserMapper {

    public UserDto toDto(User user) {
        return new UserDto(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getPhoneNumber(),
                user.getAvatarUrl(),
                user.isAdmin(),
                user.isSubscribed(),
                user.getSubscriptionExpiry(),
                user.getCreatedAt()
        );
    }
}
