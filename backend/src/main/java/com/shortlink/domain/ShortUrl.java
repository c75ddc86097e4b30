package com.shortlink.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Shortened link. A link past its expiryDate stays active until the expiration job flips it
 * (active=false, autoExpiredAt set). Soft-deleted links carry deletedAt and are ignored by jobs.
 */
@Document(collection = "urls")
@CompoundIndex(name = "expiry_auto_expired", def = "{'expiryDate': 1, 'autoExpiredAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ShortUrl {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String shortCode;
    private String originalUrl;
    /** Null for anonymous links. */
    private String userId;
    private Instant expiryDate;
    private boolean active;
    /** Set by the expiration job; null while the link has not been auto-expired. */
    private Instant autoExpiredAt;
    private Instant deletedAt;
    private Instant createdAt;
    private Instant updatedAt;
}
