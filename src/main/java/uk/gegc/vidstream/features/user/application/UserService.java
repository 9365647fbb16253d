package uk.gegc.vidstream.features.user.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.vidstream.features.user.api.dto.UpdateProfileRequest;
import uk.gegc.vidstream.features.user.api.dto.UserDto;

import java.util.UUID;

public interface UserService {

    UserDto getUser(UUID userId);

    UserDto updateProfile(UUID userId, UpdateProfileRequest request);

    Page<UserDto> listUsers(Pageable pageable);

    /**
     * Removes the account together with its payment history and reset tokens. Tokens already
     * issued to the account stop resolving immediately.
     */
    void deleteUser(UUID userId);
}
