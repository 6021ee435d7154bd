package com.example.storeauth.user;

import com.example.storeauth.dto.AdminUpdateRequest;
import com.example.storeauth.dto.PageResponse;
import com.example.storeauth.dto.UpdateProfileRequest;
import com.example.storeauth.dto.UserResponse;
import com.example.storeauth.exception.BadRequestException;
import com.example.storeauth.exception.ConflictException;
import com.example.storeauth.exception.ForbiddenException;
import com.example.storeauth.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    static final int DEFAULT_LIMIT = 10;
    static final int MAX_LIMIT = 100;

    private static final String USER_NOT_FOUND = "User not found";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Transactional(readOnly = true)
    public UserResponse getCurrentUser(Long userId) {
        return UserResponse.from(findUser(userId));
    }

    /**
     * Lists users without their email addresses.
     *
     * @param sort {@code asc} or {@code desc} by username; anything else is newest first
     */
    @Transactional(readOnly = true)
    public PageResponse<UserResponse> getAllUsers(Integer page, Integer limit, String sort) {
        int pageNumber = page == null || page < 1 ? 1 : page;
        int pageSize = limit == null ? DEFAULT_LIMIT : Math.min(Math.max(limit, 1), MAX_LIMIT);

        Page<User> result = userRepository.findAll(PageRequest.of(pageNumber - 1, pageSize, toSort(sort)));

        return new PageResponse<>(
            result.map(UserResponse::publicView).getContent(),
            new PageResponse.Pagination(result.getTotalElements(), pageNumber, pageSize, result.getTotalPages()));
    }

    @Transactional(readOnly = true)
    public UserResponse getUserById(Long id, Long requesterId, boolean requesterIsAdmin) {
        User user = findUser(id);
        if (!requesterIsAdmin && !id.equals(requesterId)) {
            throw new ForbiddenException("You do not have permission to view this user");
        }
        return UserResponse.publicView(user);
    }

    /**
     * Updates username and/or password of the caller. Email, role and activity are not self-service.
     */
    @Transactional
    public UserResponse updateProfile(Long id, Long requesterId, UpdateProfileRequest request) {
        if (!id.equals(requesterId)) {
            throw new ForbiddenException("You do not have permission to update this user");
        }
        User user = findUser(id);

        if (request.getEmail() != null) {
            throw new BadRequestException("Email cannot be changed");
        }
        if (request.getRole() != null || request.getIsActive() != null) {
            throw new ForbiddenException();
        }

        if (request.getUsername() != null && !request.getUsername().isBlank()) {
            String username = request.getUsername().trim();
            if (userRepository.existsByUsernameAndIdNot(username, id)) {
                throw new ConflictException("Username already taken");
            }
            user.setUsername(username);
        }
        if (request.getPassword() != null && !request.getPassword().isEmpty()) {
            user.setPasswordHash(passwordEncoder.encode(request.getPassword()));
        }

        User saved = userRepository.save(user);
        log.info("User {} updated their profile", saved.getId());
        return UserResponse.from(saved);
    }

    @Transactional
    public UserResponse adminUpdateUser(Long targetId, Long adminId, AdminUpdateRequest request) {
        request.getUnknownFields().keySet().stream().findFirst().ifPresent(field -> {
            throw new BadRequestException("Field '" + field + "' cannot be updated by admin");
        });
        if (targetId.equals(adminId) && request.getRole() == Role.USER) {
            throw new BadRequestException("Admin cannot demote themselves");
        }

        User user = findUser(targetId);
        if (request.getRole() != null) {
            user.setRole(request.getRole());
        }
        if (request.getIsActive() != null) {
            user.setActive(request.getIsActive());
        }

        User saved = userRepository.save(user);
        log.info("Admin {} updated user {}: role={}, active={}", adminId, saved.getId(), saved.getRole(), saved.getActive());
        return UserResponse.publicView(saved);
    }

    @Transactional
    public UserResponse deleteUser(Long id, Long requesterId, boolean requesterIsAdmin) {
        if (!requesterIsAdmin && !id.equals(requesterId)) {
            throw new ForbiddenException("You do not have permission to delete this account");
        }
        User user = findUser(id);

        userRepository.delete(user);
        log.info("User {} deleted by {}", id, requesterId);
        return UserResponse.publicView(user);
    }

    private User findUser(Long id) {
        return userRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException(USER_NOT_FOUND));
    }

    private static Sort toSort(String sort) {
        if ("asc".equals(sort)) {
            return Sort.by(Sort.Direction.ASC, "username");
        }
        if ("desc".equals(sort)) {
            return Sort.by(Sort.Direction.DESC, "username");
        }
        return Sort.by(Sort.Direction.DESC, "createdAt");
    }
}
