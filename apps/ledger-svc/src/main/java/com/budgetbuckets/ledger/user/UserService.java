package com.budgetbuckets.ledger.user;

import com.budgetbuckets.ledger.error.ResourceNotFoundException;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService {
    private final UserRepository userRepository;
    private final Clock clock;

    public UserService(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Transactional
    public UserEntity createUser(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        return userRepository.save(new UserEntity(UUID.randomUUID(), name.trim(), clock.instant()));
    }

    @Transactional(readOnly = true)
    public List<UserEntity> listUsers() {
        return userRepository.findAll(Sort.by("createdAt"));
    }

    @Transactional(readOnly = true)
    public UserEntity getUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    /** Fails with {@link ResourceNotFoundException} unless the user exists. */
    public void requireUser(UUID userId) {
        if (!userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User", userId);
        }
    }
}
