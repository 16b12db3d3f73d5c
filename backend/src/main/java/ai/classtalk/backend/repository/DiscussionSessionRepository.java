package ai.classtalk.backend.repository;

import ai.classtalk.backend.model.entity.DiscussionSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Provides CRUD and conditional-update operations for DiscussionSession entities.
 */
@Repository
public interface DiscussionSessionRepository extends JpaRepository<DiscussionSession, UUID> {

    /**
     * Returns all sessions owned by the given user, newest first.
     *
     * @param ownerId the owner's subject identifier (from JWT)
     * @return list of sessions for that owner
     */
    List<DiscussionSession> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    /**
     * Replaces the segment array and advances the cursor, but only while the stored
     * cursor still equals {@code expectedCursor} and the session is still a draft.
     * This single statement is the serialization point for concurrent appends.
     *
     * @param id             the session ID
     * @param expectedCursor the cursor the caller based its batch on
     * @param newCursor      the cursor after the append
     * @param segmentsJson   the complete segment array, serialized
     * @param updatedAt      modification timestamp
     * @return number of rows updated (0 on conflict)
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE discussion_session SET segments = :segmentsJson, segment_cursor = :newCursor, "
            + "updated_at = :updatedAt WHERE id = :id AND segment_cursor = :expectedCursor AND status = 'DRAFT'",
            nativeQuery = true)
    int compareAndSetSegments(@Param("id") UUID id,
                              @Param("expectedCursor") int expectedCursor,
                              @Param("newCursor") int newCursor,
                              @Param("segmentsJson") String segmentsJson,
                              @Param("updatedAt") Instant updatedAt);

    /**
     * Wholesale replacement of the segment array during finalization.
     * Only allowed while the session is reconciling.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE discussion_session SET segments = :segmentsJson, segment_cursor = :newCursor, "
            + "updated_at = :updatedAt WHERE id = :id AND status = 'RECONCILING'",
            nativeQuery = true)
    int replaceSegments(@Param("id") UUID id,
                        @Param("newCursor") int newCursor,
                        @Param("segmentsJson") String segmentsJson,
                        @Param("updatedAt") Instant updatedAt);

    /**
     * Atomically moves a session from DRAFT to RECONCILING. Only one finalizer can win.
     *
     * @return 1 if this caller claimed the session, 0 otherwise
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DiscussionSession s SET s.status = ai.classtalk.backend.model.entity.SessionStatus.RECONCILING, "
            + "s.updatedAt = :updatedAt WHERE s.id = :id AND s.status = ai.classtalk.backend.model.entity.SessionStatus.DRAFT")
    int claimForFinalization(@Param("id") UUID id, @Param("updatedAt") Instant updatedAt);

    /**
     * Hands a claimed session back to DRAFT after a finalization attempt failed,
     * so the next attempt can claim it again. Never touches a COMPLETE session.
     *
     * @return 1 if the claim was released, 0 if the session was not reconciling
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DiscussionSession s SET s.status = ai.classtalk.backend.model.entity.SessionStatus.DRAFT, "
            + "s.updatedAt = :updatedAt WHERE s.id = :id AND s.status = ai.classtalk.backend.model.entity.SessionStatus.RECONCILING")
    int releaseFinalizationClaim(@Param("id") UUID id, @Param("updatedAt") Instant updatedAt);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DiscussionSession s SET s.profanityCount = s.profanityCount + :profanity, "
            + "s.languageViolationCount = s.languageViolationCount + :language, s.updatedAt = :updatedAt "
            + "WHERE s.id = :id")
    int incrementViolationCounts(@Param("id") UUID id,
                                 @Param("profanity") int profanity,
                                 @Param("language") int language,
                                 @Param("updatedAt") Instant updatedAt);

    /**
     * Updates the topic configuration of a draft session without touching its segments.
     *
     * @return 1 if updated, 0 if the session is missing or no longer a draft
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE discussion_session SET topic_prompt = :topicPrompt, topic_keywords = :topicKeywordsJson, "
            + "updated_at = :updatedAt WHERE id = :id AND status = 'DRAFT'",
            nativeQuery = true)
    int updateTopicConfig(@Param("id") UUID id,
                          @Param("topicPrompt") String topicPrompt,
                          @Param("topicKeywordsJson") String topicKeywordsJson,
                          @Param("updatedAt") Instant updatedAt);

    /**
     * Updates the participation thresholds of a draft session without touching its segments.
     *
     * @return 1 if updated, 0 if the session is missing or no longer a draft
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE discussion_session SET participation_config = :configJson, updated_at = :updatedAt "
            + "WHERE id = :id AND status = 'DRAFT'",
            nativeQuery = true)
    int updateParticipationConfig(@Param("id") UUID id,
                                  @Param("configJson") String configJson,
                                  @Param("updatedAt") Instant updatedAt);

    /**
     * Reads the committed cursor without loading the segment array.
     */
    @Query("SELECT s.cursor FROM DiscussionSession s WHERE s.id = :id")
    Optional<Integer> findCursorById(@Param("id") UUID id);
}
