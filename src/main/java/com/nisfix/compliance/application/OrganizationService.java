package com.nisfix.compliance.application;

import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.OrganizationSettings;
import com.nisfix.compliance.domain.ports.OrganizationRepository;
import com.nisfix.compliance.exception.NotFoundException;
import com.nisfix.compliance.exception.ValidationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

@Service
public class OrganizationService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

    private final OrganizationRepository organizations;
    private final Clock clock;

    public OrganizationService(OrganizationRepository organizations, Clock clock) {
        this.organizations = organizations;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Organization get(UUID organizationId) {
        return organizations.findById(organizationId)
                .filter(o -> !o.isDeleted())
                .orElseThrow(() -> new NotFoundException("Organization", organizationId));
    }

    @Transactional
    public Organization updateProfile(UUID organizationId, String name, String domain, String contactEmail,
                                      String contactPhone, String address) {
        Organization org = get(organizationId);
        org.updateProfile(name, domain, contactEmail, contactPhone, address, OffsetDateTime.now(clock));
        Organization saved = organizations.save(org);
        log.info("Updated profile of organization {}", organizationId);
        return saved;
    }

    /** Null arguments keep the current setting. */
    @Transactional
    public OrganizationSettings updateSettings(UUID organizationId, Integer defaultDueDays,
                                               Integer reminderDaysBefore, Boolean requireApproval,
                                               Boolean notificationsEnabled) {
        Organization org = get(organizationId);
        OrganizationSettings current = org.getSettings();
        if (defaultDueDays != null && defaultDueDays < 1) {
            throw new ValidationFailedException("defaultDueDays must be at least 1");
        }
        if (reminderDaysBefore != null && reminderDaysBefore < 0) {
            throw new ValidationFailedException("reminderDaysBefore must not be negative");
        }
        OrganizationSettings updated = new OrganizationSettings(
                defaultDueDays != null ? defaultDueDays : current.defaultDueDays(),
                reminderDaysBefore != null ? reminderDaysBefore : current.reminderDaysBefore(),
                requireApproval != null ? requireApproval : current.requireApproval(),
                notificationsEnabled != null ? notificationsEnabled : current.notificationsEnabled());
        org.updateSettings(updated, OffsetDateTime.now(clock));
        organizations.save(org);
        log.info("Updated settings of organization {}: {}", organizationId, updated);
        return updated;
    }
}
