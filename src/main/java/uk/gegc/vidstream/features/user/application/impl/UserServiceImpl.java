package uk.gegc.vidstream.features.user.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.vidstream.features.auth.domain.exception.DuplicateIdentityException;
import uk.gegc.vidstream.features.auth.domain.repository.PasswordResetTokenRepository;
import uk.gegc.vidstream.features.subscription.domain.repository.PaymentTransactionRepository;
import uk.gegc.vidstream.features.user.api.dto.UpdateProfileRequest;
import uk.gegc.vidstream.features.user.api.dto.UserDto;
import uk.gegc.vidstream.features.user.application.UserService;
import uk.gegc.vidstream.features.user.domain.model.User;
import uk.gegc.vidstream.features.user.domain.repository.UserRepository;
import uk.gegc.vidstream.features.user.infra.mapping.UserMapper;
import uk.gegc.vidstream.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private final UserRepository userRepository;
    private final PaymentTransactionRepository paymentTransactionRepository;
    private final PasswordResetTokenRepository passwordResetTokenRepository;
    private final PasswordEncoder passwordEncoder;
    private final UserMapper userMapper;
    @Qualifier("utcClock")
    private final Clock utcClock;

    @Override
    @Transactional(readOnly = true)
    public UserDto getUser(UUID userId) {
        return userMapper.toDto(loadUser(userId));
    }

    @Override
    @Transactional
    public UserDto updateProfile(UUID userId, UpdateProfileRequest request) {
        User user = loadUser(userId);

        if (request.username() != null && !request.username().equals(user.getUsername())) {
            if (userRepository.existsByUsernameAndIdNot(request.username(), userId)) {
                throw new DuplicateIdentityException("Username already registered");
            }
            user.setUsername(request.username());
        }
        if (request.email() != null && !request.email().equals(user.getEmail())) {
            if (userRepository.existsByEmailAndIdNot(request.email(), userId)) {
                throw new DuplicateIdentityException("Email already registered");
            }
            user.setEmail(request.email());
        }
        if (request.firstName() != null) {
            user.setFirstName(request.firstName());
        }
        if (request.lastName() != null) {
            user.setLastName(request.lastName());
        }
        if (request.phoneNumber() != null) {
            user.setPhoneNumber(request.phoneNumber());
        }
        if (request.avatarUrl() != null) {
            user.setAvatarUrl(request.avatarUrl());
        }
        if (request.password() != null) {
            user.setHashedPassword(passwordEncoder.encode(request.password()));
            user.setPasswordChangedAt(LocalDateTime.now(utcClock));
        }

        return userMapper.toDto(userRepository.save(user));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<UserDto> listUsers(Pageable pageable) {
        return userRepository.findAllByOrderByCreatedAtDesc(pageable).map(userMapper::toDto);
    }

    @Override
    @Transactional
    public void deleteUser(UUID userId) {
        User user = loadUser(userId);
        int payments = paymentTransactionRepository.deleteByUserId(userId);
        passwordResetTokenRepository.deleteByUserId(userId);
        userRepository.delete(user);
        log.info("Deleted user {} and {} payment transaction(s)", userId, payments);
    }

    private User loadUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User " + userId + " not found"));
    }
}
