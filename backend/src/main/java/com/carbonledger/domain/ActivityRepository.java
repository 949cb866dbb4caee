package com.carbonledger.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.repository.NoRepositoryBean;

import java.util.List;
import java.util.Optional;

/**
 * Finders shared by the three activity collections. Only active (not soft-deleted) records are returned.
 */
@NoRepositoryBean
public interface ActivityRepository<A extends ActivityRecord> extends MongoRepository<A, String> {

    /** One page of active activities; callers pass a Pageable sorted by id for stable offsets. */
    List<A> findByDeletedFalse(Pageable pageable);

    Optional<A> findByIdAndDeletedFalse(String id);

    long countByDeletedFalse();
}
