package com.dnsfilter.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Account - a registered user owning zero or more realms.
 *
 * Accounts log into the (external) management UI; API access always goes
 * through a realm-scoped token, never the account password.
 */
@Entity
@Table(name = "accounts", indexes = {
    @Index(name = "idx_account_username", columnList = "username"),
    @Index(name = "idx_account_email", columnList = "email")
})
public class Account {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "username", nullable = false, unique = true, length = 64)
    private String username;

    @NotNull
    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @NotNull
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "approved", nullable = false)
    private boolean approved;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "approved_at")
    private Instant approvedAt;

    protected Account() {}

    /**
     * Creates a pending account. The password must already be hashed.
     */
    public static Account register(String username, String email, String passwordHash) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("Password hash is required");
        }
        var account = new Account();
        account.id = UUID.randomUUID();
        account.username = username;
        account.email = email.toLowerCase();
        account.passwordHash = passwordHash;
        account.approved = false;
        account.active = true;
        account.createdAt = Instant.now();
        return account;
    }

    public void approve() {
        this.approved = true;
        this.approvedAt = Instant.now();
    }

    public void disable() {
        this.active = false;
    }

    public void enable() {
        this.active = true;
    }

    /**
     * Only approved, active accounts may have their tokens used.
     */
    public boolean canAuthenticate() {
        return approved && active;
    }

    // Getters
    public UUID getId() { return id; }
    public String getUsername() { return username; }
    public String getEmail() { return email; }
    public String getPasswordHash() { return passwordHash; }
    public boolean isApproved() { return approved; }
    public boolean isActive() { return active; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getApprovedAt() { return approvedAt; }
}
