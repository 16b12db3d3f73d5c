package ai.classtalk.backend.analysis;

import ai.classtalk.backend.model.dto.ParticipationBalance;
import ai.classtalk.backend.model.dto.TranscriptSegment;
import ai.classtalk.backend.model.entity.DiscussionSession;
import ai.classtalk.backend.service.QualityLogService;
import ai.classtalk.backend.service.exception.ModerationServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs the analyzer set for an appended batch or for a whole session.
 *
 * The analyzers share no state, so full-session analysis runs them concurrently
 * over the same immutable segment list.
 */
@Service
public class ContentAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(ContentAnalysisService.class);

    private final ProfanityAnalyzer profanityAnalyzer;
    private final LanguagePolicyAnalyzer languagePolicyAnalyzer;
    private final ParticipationAnalyzer participationAnalyzer;
    private final TopicAdherenceAnalyzer topicAdherenceAnalyzer;
    private final QualityLogService qualityLogService;
    private final Executor analysisExecutor;
    private final double adherenceThreshold;

    @Autowired
    public ContentAnalysisService(ProfanityAnalyzer profanityAnalyzer,
                                  LanguagePolicyAnalyzer languagePolicyAnalyzer,
                                  ParticipationAnalyzer participationAnalyzer,
                                  TopicAdherenceAnalyzer topicAdherenceAnalyzer,
                                  QualityLogService qualityLogService,
                                  @Qualifier("analysisExecutor") Executor analysisExecutor,
                                  @Value("${app.moderation.topic.adherence-threshold:0.7}") double adherenceThreshold) {
        this.profanityAnalyzer = profanityAnalyzer;
        this.languagePolicyAnalyzer = languagePolicyAnalyzer;
        this.participationAnalyzer = participationAnalyzer;
        this.topicAdherenceAnalyzer = topicAdherenceAnalyzer;
        this.qualityLogService = qualityLogService;
        this.analysisExecutor = analysisExecutor;
        this.adherenceThreshold = adherenceThreshold;
    }

    /**
     * Analyzes the segments committed by one append, each against the history up to itself.
     *
     * @param session                the session the batch belongs to
     * @param committed              the full committed segment sequence after the append
     * @param fromIndex              index of the first newly appended segment
     * @param flaggedParticipation   participation conditions already flagged for this session
     */
    public IncomingAnalysis analyzeIncoming(DiscussionSession session,
                                            List<TranscriptSegment> committed,
                                            int fromIndex,
                                            Set<String> flaggedParticipation) {
        UUID sessionId = session.getId();
        List<DetectedFlag> profanity = new ArrayList<>();
        List<DetectedFlag> language = new ArrayList<>();
        List<DetectedFlag> participation = new ArrayList<>();
        List<DetectedFlag> all = new ArrayList<>();

        for (int index = fromIndex; index < committed.size(); index++) {
            TranscriptSegment segment = committed.get(index);
            List<TranscriptSegment> single = List.of(segment);

            List<DetectedFlag> segmentProfanity = profanityAnalyzer.analyze(sessionId, single);
            List<DetectedFlag> segmentLanguage = languagePolicyAnalyzer.analyze(sessionId, single, session.getLanguage());
            List<DetectedFlag> segmentParticipation = participationAnalyzer.analyzeIncoming(sessionId, segment,
                    committed.subList(0, index + 1), session.getParticipationConfig(), flaggedParticipation);

            profanity.addAll(segmentProfanity);
            language.addAll(segmentLanguage);
            participation.addAll(segmentParticipation);
            all.addAll(segmentProfanity);
            all.addAll(segmentLanguage);
            all.addAll(segmentParticipation);
        }

        logger.debug("Incoming analysis for session {}: {} profanity, {} language, {} participation flags",
                sessionId, profanity.size(), language.size(), participation.size());

        return IncomingAnalysis.builder()
                .profanityFlags(profanity)
                .languagePolicyFlags(language)
                .participationFlags(participation)
                .allFlags(all)
                .build();
    }

    /**
     * Runs all four analyzers over the final segment set and records the decisions in the quality log.
     */
    public SessionAnalysis analyzeSession(DiscussionSession session, List<TranscriptSegment> segments) {
        UUID sessionId = session.getId();
        List<TranscriptSegment> snapshot = List.copyOf(segments);
        String allowedLanguage = languagePolicyAnalyzer.resolveAllowedLanguage(session.getLanguage());

        CompletableFuture<List<DetectedFlag>> profanityFuture = CompletableFuture.supplyAsync(
                () -> profanityAnalyzer.analyze(sessionId, snapshot), analysisExecutor);
        CompletableFuture<List<DetectedFlag>> languageFuture = CompletableFuture.supplyAsync(
                () -> languagePolicyAnalyzer.analyze(sessionId, snapshot, allowedLanguage), analysisExecutor);
        CompletableFuture<ParticipationBalance> participationFuture = CompletableFuture.supplyAsync(
                () -> participationAnalyzer.analyze(snapshot, session.getParticipationConfig()), analysisExecutor);
        CompletableFuture<TopicAdherenceResult> topicFuture = CompletableFuture.supplyAsync(
                () -> topicAdherenceAnalyzer.analyze(sessionId, snapshot, session.getTopicKeywords()), analysisExecutor);

        SessionAnalysis analysis;
        try {
            CompletableFuture.allOf(profanityFuture, languageFuture, participationFuture, topicFuture).join();

            ParticipationBalance balance = participationFuture.join();
            analysis = SessionAnalysis.builder()
                    .profanityFlags(profanityFuture.join())
                    .languagePolicyFlags(languageFuture.join())
                    .participationBalance(balance)
                    .participationFlags(participationAnalyzer.sessionFlags(sessionId, snapshot, balance))
                    .topicAdherence(topicFuture.join())
                    .build();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Session analysis failed for session {}: {}", sessionId, cause.getMessage());
            throw new ModerationServiceException("Session analysis failed", cause);
        }

        logDecisions(sessionId, analysis, allowedLanguage);
        logger.info("Session analysis for {} complete: {} flags, balanced={}, topic adherence={}",
                sessionId, analysis.allFlags().size(), analysis.getParticipationBalance().isBalanced(),
                analysis.getTopicAdherence().getScore());
        return analysis;
    }

    public double getAdherenceThreshold() {
        return adherenceThreshold;
    }

    private void logDecisions(UUID sessionId, SessionAnalysis analysis, String allowedLanguage) {
        if (!analysis.getProfanityFlags().isEmpty()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("count", analysis.getProfanityFlags().size());
            metadata.put("words", analysis.getProfanityFlags().stream()
                    .map(DetectedFlag::getFlaggedWord).collect(Collectors.toList()));
            qualityLogService.logDetectionDecision(sessionId, "profanity_detected", metadata);
        }

        if (!analysis.getLanguagePolicyFlags().isEmpty()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("count", analysis.getLanguagePolicyFlags().size());
            metadata.put("detectedLanguages", new ArrayList<>(analysis.getLanguagePolicyFlags().stream()
                    .map(DetectedFlag::getFlaggedWord).collect(Collectors.toCollection(TreeSet::new))));
            metadata.put("allowedLanguage", allowedLanguage);
            qualityLogService.logDetectionDecision(sessionId, "language_policy_violation", metadata);
        }

        ParticipationBalance balance = analysis.getParticipationBalance();
        if (!balance.isBalanced()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("dominantSpeaker", balance.getDominantSpeaker());
            metadata.put("silentSpeakers", balance.getSilentSpeakers());
            metadata.put("reason", balance.getImbalanceReason());
            qualityLogService.logDetectionDecision(sessionId, "participation_imbalance", metadata);
        }

        TopicAdherenceResult topic = analysis.getTopicAdherence();
        if (topic.getScore() < adherenceThreshold) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("score", topic.getScore());
            metadata.put("offTopicCount", topic.getOffTopicFlags().size());
            qualityLogService.logDetectionDecision(sessionId, "low_topic_adherence", metadata);
        }

        Map<String, Object> balanceValue = new LinkedHashMap<>();
        balanceValue.put("speakers", balance.getSpeakers());
        balanceValue.put("isBalanced", balance.isBalanced());
        qualityLogService.logQualityMetric(sessionId, "participation_balance", balanceValue, null);

        Map<String, Object> topicMetadata = new LinkedHashMap<>();
        topicMetadata.put("detectedKeywords", topic.getDetectedKeywords());
        topicMetadata.put("offTopicIndicators", topic.getDetectedOffTopicIndicators());
        qualityLogService.logQualityMetric(sessionId, "topic_adherence_score", topic.getScore(), topicMetadata);
    }
}
