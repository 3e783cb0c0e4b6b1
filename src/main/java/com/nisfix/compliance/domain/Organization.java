package com.nisfix.compliance.domain;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * A tenant: either a company that assigns requirements or a supplier that answers them.
 */
public class Organization {
    private final UUID id;
    private final OrganizationType type;
    private String name;
    private final String slug;
    private String domain;
    private String contactEmail;
    private String contactPhone;
    private String address;
    private OrganizationSettings settings;
    private final OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private final OffsetDateTime deletedAt;

    public Organization(UUID id, OrganizationType type, String name, String slug, String domain,
                        String contactEmail, String contactPhone, String address,
                        OrganizationSettings settings, OffsetDateTime createdAt,
                        OffsetDateTime updatedAt, OffsetDateTime deletedAt) {
        this.id = id;
        this.type = type;
        this.name = name;
        this.slug = slug;
        this.domain = domain;
        this.contactEmail = contactEmail;
        this.contactPhone = contactPhone;
        this.address = address;
        this.settings = settings == null ? OrganizationSettings.defaults() : settings;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.deletedAt = deletedAt;
    }

    public static Organization create(OrganizationType type, String name, String domain,
                                      String contactEmail, OffsetDateTime now) {
        return new Organization(UUID.randomUUID(), type, name, slugify(name), domain, contactEmail,
                null, null, OrganizationSettings.defaults(), now, now, null);
    }

    public void updateProfile(String name, String domain, String contactEmail, String contactPhone,
                              String address, OffsetDateTime now) {
        if (name != null && !name.isBlank()) this.name = name.trim();
        if (domain != null) this.domain = domain;
        if (contactEmail != null) this.contactEmail = contactEmail;
        if (contactPhone != null) this.contactPhone = contactPhone;
        if (address != null) this.address = address;
        this.updatedAt = now;
    }

    public void updateSettings(OrganizationSettings settings, OffsetDateTime now) {
        this.settings = settings;
        this.updatedAt = now;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isCompany() {
        return type == OrganizationType.COMPANY;
    }

    public boolean isSupplier() {
        return type == OrganizationType.SUPPLIER;
    }

    static String slugify(String name) {
        String base = name == null ? "org" : name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-|-$)", "");
        if (base.isEmpty()) base = "org";
        // suffix keeps slugs unique for organizations sharing a display name
        return base + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public UUID getId() { return id; }
    public OrganizationType getType() { return type; }
    public String getName() { return name; }
    public String getSlug() { return slug; }
    public String getDomain() { return domain; }
    public String getContactEmail() { return contactEmail; }
    public String getContactPhone() { return contactPhone; }
    public String getAddress() { return address; }
    public OrganizationSettings getSettings() { return settings; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public OffsetDateTime getDeletedAt() { return deletedAt; }
}
