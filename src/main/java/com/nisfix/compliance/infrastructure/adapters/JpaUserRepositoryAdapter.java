package com.nisfix.compliance.infrastructure.adapters;

import com.nisfix.compliance.domain.User;
import com.nisfix.compliance.domain.UserRole;
import com.nisfix.compliance.domain.ports.UserRepository;
import com.nisfix.compliance.infrastructure.jpa.SpringUserRepository;
import com.nisfix.compliance.infrastructure.jpa.UserEntity;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaUserRepositoryAdapter implements UserRepository {
    private final SpringUserRepository users;

    public JpaUserRepositoryAdapter(SpringUserRepository users) {
        this.users = users;
    }

    @Override
    public User save(User u) {
        UserEntity e = users.findById(u.getId()).orElseGet(UserEntity::new);
        e.setId(u.getId());
        e.setEmail(u.getEmail());
        e.setName(u.getName());
        e.setRole(u.getRole().name());
        e.setOrganizationId(u.getOrganizationId());
        e.setActive(u.isActive());
        e.setLastLoginAt(u.getLastLoginAt());
        e.setCreatedAt(u.getCreatedAt());
        e.setDeletedAt(u.getDeletedAt());
        users.save(e);
        return u;
    }

    @Override
    public Optional<User> findById(UUID id) {
        return users.findById(id).map(JpaUserRepositoryAdapter::toDomain);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return users.findByEmail(User.normalizeEmail(email)).map(JpaUserRepositoryAdapter::toDomain);
    }

    @Override
    @Transactional
    public void updateLastLogin(UUID userId, OffsetDateTime at) {
        users.updateLastLogin(userId, at);
    }

    private static User toDomain(UserEntity e) {
        return new User(e.getId(), e.getEmail(), e.getName(), UserRole.valueOf(e.getRole()), e.getOrganizationId(),
                e.isActive(), e.getLastLoginAt(), e.getCreatedAt(), e.getDeletedAt());
    }
}
