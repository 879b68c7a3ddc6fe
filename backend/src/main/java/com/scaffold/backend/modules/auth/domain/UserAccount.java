package com.scaffold.backend.modules.auth.domain;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import com.scaffold.backend.global.jpa.AbstractTimestampedEntity;
import com.scaffold.backend.modules.rbac.domain.Role;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Identity record. Holds a password hash, an OAuth provider identity, or both.
 */
@Entity
@Table(name = "users")
public class UserAccount extends AbstractTimestampedEntity {

    public static final String PASSWORD_PROVIDER = "password";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "password_hash", length = 255)
    private String passwordHash;

    @Column(name = "name", length = 255)
    private String name;

    @Column(name = "auth_provider", length = 32)
    private String authProvider;

    @Column(name = "auth_provider_id", length = 255)
    private String authProviderId;

    @Column(name = "auth_provider_data", columnDefinition = "text")
    private String authProviderData;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "user_roles",
            joinColumns = @JoinColumn(name = "user_id"),
            inverseJoinColumns = @JoinColumn(name = "role_id")
    )
    private Set<Role> roles = new LinkedHashSet<>();

    /**
     * Canonical form used for storage and lookups: trimmed, lower case.
     */
    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isEmpty();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAuthProvider() {
        return authProvider;
    }

    public String getAuthProviderId() {
        return authProviderId;
    }

    public String getAuthProviderData() {
        return authProviderData;
    }

    public void setAuthProviderData(String authProviderData) {
        this.authProviderData = authProviderData;
    }

    /**
     * Binds this account to a third-party identity, replacing any previous one.
     */
    public void linkProvider(String provider, String providerId, String providerData) {
        this.authProvider = provider;
        this.authProviderId = providerId;
        this.authProviderData = providerData;
    }

    public void usePasswordProvider() {
        this.authProvider = PASSWORD_PROVIDER;
        this.authProviderId = null;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Set<Role> getRoles() {
        return roles;
    }
}
