package com.shortlink.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * User account fields relevant to password reset housekeeping.
 * A reset token is valid until passwordResetExpiresAt (one hour after it was issued).
 */
@Document(collection = "users")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UserAccount {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String email;
    private String passwordResetToken;
    @Indexed(sparse = true)
    private Instant passwordResetExpiresAt;
    private Instant passwordResetRequestedAt;
    private Instant updatedAt;
}
