package com.authplatform.validitysvc.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

/**
 * Validity state of one account: when it expires, whether the renewal notice went out
 * for the current period, and the single active renewal token.
 * <p>
 * The id is assigned, so newness is tracked explicitly: a record built in memory is
 * inserted and never merged over an existing row.
 */
@Entity
@Table(name = "email_account_validity",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_long_renewal_token", columnNames = "long_renewal_token"),
                @UniqueConstraint(name = "uq_short_renewal_token_user", columnNames = {"short_renewal_token", "user_id"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountValidity implements Persistable<String> {

    @Id
    @Column(name = "user_id", nullable = false, length = 255)
    private String userId;

    @Column(name = "expiration_ts_ms", nullable = false)
    private long expirationTsMs;

    @Column(name = "email_sent", nullable = false)
    private boolean emailSent;

    @Column(name = "long_renewal_token", length = 64)
    private String longRenewalToken;

    @Column(name = "short_renewal_token", length = 16)
    private String shortRenewalToken;

    @Column(name = "token_used_ts_ms")
    private Long tokenUsedTsMs;

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean persisted;

    @Override
    public String getId() {
        return userId;
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.persisted = true;
    }

    /**
     * Stores the token in the column its format selects and clears the other one.
     */
    public void assignToken(String token) {
        if (token == null) {
            this.longRenewalToken = null;
            this.shortRenewalToken = null;
        } else if (TokenFormat.of(token) == TokenFormat.MANUAL) {
            this.shortRenewalToken = token;
            this.longRenewalToken = null;
        } else {
            this.longRenewalToken = token;
            this.shortRenewalToken = null;
        }
    }

    public String currentToken() {
        return longRenewalToken != null ? longRenewalToken : shortRenewalToken;
    }

    public boolean isTokenUsed() {
        return tokenUsedTsMs != null;
    }

    public boolean isExpiredAt(long nowMs) {
        return nowMs >= expirationTsMs;
    }
}
