package com.shortlink.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed {@link UrlExpirationStore} over the urls collection.
 */
@Repository
@RequiredArgsConstructor
public class MongoUrlExpirationStore implements UrlExpirationStore {

    static final Duration EXPIRING_SOON_WINDOW = Duration.ofDays(7);

    private final MongoTemplate mongoTemplate;

    @Override
    public List<ExpiredUrlCandidate> findExpiredCandidates(int limit, long offset, Instant now) {
        Query query = new Query(where("expiryDate").lt(now)
                .and("active").is(true)
                .and("deletedAt").is(null)
                .and("autoExpiredAt").is(null))
                .with(Sort.by(Sort.Direction.ASC, "expiryDate"))
                .skip(offset)
                .limit(limit);
        query.fields().include("shortCode", "userId", "expiryDate", "originalUrl");
        return mongoTemplate.find(query, ShortUrl.class).stream()
                .map(u -> new ExpiredUrlCandidate(u.getId(), u.getShortCode(), u.getUserId(),
                        u.getExpiryDate(), u.getOriginalUrl()))
                .toList();
    }

    @Override
    public long markExpired(Collection<String> ids, Instant now) {
        if (ids.isEmpty()) {
            return 0;
        }
        Query query = new Query(where("id").in(ids)
                .and("active").is(true)
                .and("autoExpiredAt").is(null));
        Update update = new Update()
                .set("active", false)
                .set("autoExpiredAt", now)
                .set("updatedAt", now);
        return mongoTemplate.updateMulti(query, update, ShortUrl.class).getModifiedCount();
    }

    @Override
    public UrlStatistics aggregateStatistics(Instant now) {
        return new UrlStatistics(
                count(notDeleted()),
                count(notDeleted().and("active").is(true)),
                count(notDeleted().and("active").is(false)),
                count(notDeleted().and("expiryDate").lt(now)),
                count(notDeleted().and("autoExpiredAt").ne(null)),
                count(notDeleted().and("expiryDate").gt(now).lt(now.plus(EXPIRING_SOON_WINDOW)))
        );
    }

    @Override
    public long softDeleteAutoExpiredBefore(Instant cutoff, Instant now) {
        Query query = new Query(where("autoExpiredAt").lt(cutoff)
                .and("deletedAt").is(null));
        Update update = new Update()
                .set("deletedAt", now)
                .set("updatedAt", now);
        return mongoTemplate.updateMulti(query, update, ShortUrl.class).getModifiedCount();
    }

    private static Criteria notDeleted() {
        return where("deletedAt").is(null);
    }

    private long count(Criteria criteria) {
        return mongoTemplate.count(new Query(criteria), ShortUrl.class);
    }
}
