package com.shortlink.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for users.
 */
public interface UserAccountRepository extends MongoRepository<UserAccount, String>, UserAccountRepositoryCustom {

    Optional<UserAccount> findByEmail(String email);
}
