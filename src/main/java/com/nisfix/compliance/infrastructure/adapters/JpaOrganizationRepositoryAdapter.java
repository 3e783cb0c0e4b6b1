package com.nisfix.compliance.infrastructure.adapters;

import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.OrganizationSettings;
import com.nisfix.compliance.domain.OrganizationType;
import com.nisfix.compliance.domain.ports.OrganizationRepository;
import com.nisfix.compliance.infrastructure.jpa.OrganizationEntity;
import com.nisfix.compliance.infrastructure.jpa.SpringOrganizationRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
public class JpaOrganizationRepositoryAdapter implements OrganizationRepository {
    private final SpringOrganizationRepository organizations;

    public JpaOrganizationRepositoryAdapter(SpringOrganizationRepository organizations) {
        this.organizations = organizations;
    }

    @Override
    public Organization save(Organization o) {
        OrganizationEntity e = organizations.findById(o.getId()).orElseGet(OrganizationEntity::new);
        e.setId(o.getId());
        e.setType(o.getType().name());
        e.setName(o.getName());
        e.setSlug(o.getSlug());
        e.setDomain(o.getDomain());
        e.setContactEmail(o.getContactEmail());
        e.setContactPhone(o.getContactPhone());
        e.setAddress(o.getAddress());
        OrganizationSettings s = o.getSettings();
        e.setDefaultDueDays(s.defaultDueDays());
        e.setReminderDaysBefore(s.reminderDaysBefore());
        e.setRequireApproval(s.requireApproval());
        e.setNotificationsEnabled(s.notificationsEnabled());
        e.setCreatedAt(o.getCreatedAt());
        e.setUpdatedAt(o.getUpdatedAt());
        e.setDeletedAt(o.getDeletedAt());
        organizations.save(e);
        return o;
    }

    @Override
    public Optional<Organization> findById(UUID id) {
        return organizations.findById(id).map(JpaOrganizationRepositoryAdapter::toDomain);
    }

    private static Organization toDomain(OrganizationEntity e) {
        return new Organization(e.getId(), OrganizationType.valueOf(e.getType()), e.getName(), e.getSlug(),
                e.getDomain(), e.getContactEmail(), e.getContactPhone(), e.getAddress(),
                new OrganizationSettings(e.getDefaultDueDays(), e.getReminderDaysBefore(),
                        e.isRequireApproval(), e.isNotificationsEnabled()),
                e.getCreatedAt(), e.getUpdatedAt(), e.getDeletedAt());
    }
}
