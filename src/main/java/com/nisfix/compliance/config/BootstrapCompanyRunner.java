package com.nisfix.compliance.config;

import com.nisfix.compliance.application.TemplateService;
import com.nisfix.compliance.domain.Organization;
import com.nisfix.compliance.domain.OrganizationType;
import com.nisfix.compliance.domain.User;
import com.nisfix.compliance.domain.UserRole;
import com.nisfix.compliance.domain.ports.OrganizationRepository;
import com.nisfix.compliance.domain.ports.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Seeds a company organization and its first admin so a fresh installation has someone who can
 * request a sign-in link, and loads the system questionnaire templates.
 */
@Configuration
public class BootstrapCompanyRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapCompanyRunner.class);

    @Bean
    ApplicationRunner seedCompany(
            OrganizationRepository organizations,
            UserRepository users,
            Clock clock,
            @Value("${bootstrap.company.name:}") String companyName,
            @Value("${bootstrap.company.domain:}") String domain,
            @Value("${bootstrap.company.admin-email:}") String adminEmail,
            @Value("${bootstrap.company.admin-name:Administrator}") String adminName
    ) {
        return args -> {
            if (companyName.isBlank() || adminEmail.isBlank()) {
                log.info("Bootstrap company not created - set bootstrap.company.name and bootstrap.company.admin-email");
                return;
            }
            if (users.findByEmail(User.normalizeEmail(adminEmail)).isPresent()) {
                log.info("Bootstrap admin exists: {}", adminEmail);
                return;
            }

            OffsetDateTime now = OffsetDateTime.now(clock);
            Organization company = organizations.save(Organization.create(OrganizationType.COMPANY, companyName,
                    domain.isBlank() ? null : domain, adminEmail, now));
            User admin = users.save(User.create(adminEmail, adminName, UserRole.ADMIN, company.getId(), now));
            log.info("Bootstrap company created: {} ({}) with admin {}", company.getName(), company.getId(),
                    admin.getEmail());
        };
    }

    @Bean
    ApplicationRunner seedSystemTemplates(
            TemplateService templates,
            @Value("${bootstrap.templates.enabled:true}") boolean enabled
    ) {
        return args -> {
            if (!enabled) {
                log.info("System template seeding disabled");
                return;
            }
            templates.seedSystemTemplates();
        };
    }
}
