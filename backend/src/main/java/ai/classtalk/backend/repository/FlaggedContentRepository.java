package ai.classtalk.backend.repository;

import ai.classtalk.backend.model.entity.FlagType;
import ai.classtalk.backend.model.entity.FlaggedContent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Flag store: append-only collection of flagged content keyed by session.
 */
@Repository
public interface FlaggedContentRepository extends JpaRepository<FlaggedContent, UUID> {

    /**
     * Returns all flags of a session in transcript order.
     */
    List<FlaggedContent> findBySessionIdOrderByTimestampMsAsc(UUID sessionId);

    List<FlaggedContent> findBySessionIdAndFlagType(UUID sessionId, FlagType flagType);

    long countBySessionIdAndFlagType(UUID sessionId, FlagType flagType);

    /**
     * Returns the flags of every session owned by the given user, newest first.
     */
    @Query("SELECT f FROM FlaggedContent f WHERE f.sessionId IN "
            + "(SELECT s.id FROM DiscussionSession s WHERE s.ownerId = :ownerId) ORDER BY f.createdAt DESC")
    List<FlaggedContent> findByOwnerId(@Param("ownerId") String ownerId);

    /**
     * Bulk-deletes the flags of the given types for one session.
     *
     * @return number of deleted records
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM FlaggedContent f WHERE f.sessionId = :sessionId AND f.flagType IN :flagTypes")
    int deleteBySessionIdAndFlagTypes(@Param("sessionId") UUID sessionId,
                                      @Param("flagTypes") Collection<FlagType> flagTypes);
}
