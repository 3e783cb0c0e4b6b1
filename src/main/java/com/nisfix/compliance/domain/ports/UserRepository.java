package com.nisfix.compliance.domain.ports;

import com.nisfix.compliance.domain.User;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

public interface UserRepository {
    User save(User user);

    Optional<User> findById(UUID id);

    Optional<User> findByEmail(String email);

    void updateLastLogin(UUID userId, OffsetDateTime at);
}
