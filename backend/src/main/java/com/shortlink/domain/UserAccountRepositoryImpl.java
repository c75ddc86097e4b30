package com.shortlink.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed bulk updates for users.
 */
@Repository
@RequiredArgsConstructor
public class UserAccountRepositoryImpl implements UserAccountRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public long clearPasswordResetTokensExpiredBefore(Instant now) {
        Query query = new Query(where("passwordResetToken").ne(null)
                .and("passwordResetExpiresAt").lt(now));
        Update update = new Update()
                .unset("passwordResetToken")
                .unset("passwordResetExpiresAt")
                .unset("passwordResetRequestedAt")
                .set("updatedAt", now);
        return mongoTemplate.updateMulti(query, update, UserAccount.class).getModifiedCount();
    }
}
