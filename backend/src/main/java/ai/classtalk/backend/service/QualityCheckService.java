package ai.classtalk.backend.service;

import ai.classtalk.backend.analysis.DetectedFlag;
import ai.classtalk.backend.analysis.SessionAnalysis;
import ai.classtalk.backend.model.dto.ParticipationBalance;
import ai.classtalk.backend.model.dto.SpeakerParticipation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Sanity checks over a finalized session's analysis.
 *
 * Results only go to the quality log; they never change the session or its flags.
 */
@Service
public class QualityCheckService {

    private static final Logger logger = LoggerFactory.getLogger(QualityCheckService.class);

    static final List<String> FALSE_POSITIVE_STEMS = Arrays.asList("class", "pass", "assess", "analysis");

    private static final double MAX_PROFANITY_FLAGS_PER_SEGMENT = 0.5;
    private static final double MEANINGFUL_SHARE = 0.1;
    private static final double UNREASONABLE_DOMINANCE = 0.7;
    private static final double MAX_ALERTS_PER_MINUTE = 5.0;
    private static final int MIN_ALERTS_FOR_DIVERSITY_CHECK = 3;

    private final QualityLogService qualityLogService;

    @Autowired
    public QualityCheckService(QualityLogService qualityLogService) {
        this.qualityLogService = qualityLogService;
    }

    /**
     * Runs every check and logs each result plus a summary.
     *
     * @param segmentCount     number of segments analyzed
     * @param flags            all flags produced by the final analysis
     * @param durationSeconds  session length
     * @param allowedLanguage  the language the session was checked against
     */
    public List<QualityCheckResult> runAll(UUID sessionId, SessionAnalysis analysis, int segmentCount,
                                           List<DetectedFlag> flags, double durationSeconds, String allowedLanguage) {
        List<QualityCheckResult> results = new ArrayList<>();
        results.add(checkProfanityAccuracy(analysis.getProfanityFlags(), segmentCount));
        results.add(checkLanguagePolicy(analysis.getLanguagePolicyFlags(), allowedLanguage));
        results.add(checkParticipationReasonableness(analysis.getParticipationBalance()));
        results.add(checkAlertRate(flags, durationSeconds));

        for (QualityCheckResult result : results) {
            qualityLogService.logTestResult(sessionId, result.getCheckName(), result.isPassed(), result.getDetails());
        }

        long passedCount = results.stream().filter(QualityCheckResult::isPassed).count();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("passedCount", passedCount);
        summary.put("totalChecks", results.size());
        summary.put("allPassed", passedCount == results.size());
        summary.put("results", results.stream()
                .map(r -> r.getCheckName() + ":" + (r.isPassed() ? "passed" : "failed"))
                .collect(Collectors.toList()));
        qualityLogService.logQualityMetric(sessionId, "quality_checks_summary", summary, null);

        if (passedCount < results.size()) {
            logger.warn("Session {} failed {} of {} quality checks", sessionId, results.size() - passedCount, results.size());
        }
        return results;
    }

    QualityCheckResult checkProfanityAccuracy(List<DetectedFlag> profanityFlags, int segmentCount) {
        boolean hasFalsePositives = profanityFlags.stream()
                .anyMatch(flag -> FALSE_POSITIVE_STEMS.stream()
                        .anyMatch(stem -> flag.getFlaggedWord().toLowerCase(Locale.ROOT).contains(stem)));
        double flagsPerSegment = segmentCount > 0 ? (double) profanityFlags.size() / segmentCount : 0;
        boolean spammy = flagsPerSegment > MAX_PROFANITY_FLAGS_PER_SEGMENT;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalFlags", profanityFlags.size());
        details.put("flagsPerSegment", flagsPerSegment);
        details.put("hasFalsePositives", hasFalsePositives);
        details.put("isSpammy", spammy);
        details.put("flaggedWords", profanityFlags.stream().map(DetectedFlag::getFlaggedWord).collect(Collectors.toList()));

        return new QualityCheckResult("profanity_detection_accuracy", !hasFalsePositives && !spammy, details);
    }

    QualityCheckResult checkLanguagePolicy(List<DetectedFlag> languageFlags, String allowedLanguage) {
        boolean englishAllowed = "en".equalsIgnoreCase(allowedLanguage) || "english".equalsIgnoreCase(allowedLanguage);
        boolean englishFlagged = englishAllowed && languageFlags.stream()
                .map(flag -> flag.getFlaggedWord().toLowerCase(Locale.ROOT))
                .anyMatch(word -> word.equals("en") || word.equals("english"));

        Set<String> detected = languageFlags.stream().map(DetectedFlag::getFlaggedWord)
                .collect(Collectors.toCollection(TreeSet::new));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalViolations", languageFlags.size());
        details.put("detectedLanguages", new ArrayList<>(detected));
        details.put("hasEnglishFalsePositives", englishFlagged);

        return new QualityCheckResult("language_policy_detection", !englishFlagged, details);
    }

    QualityCheckResult checkParticipationReasonableness(ParticipationBalance balance) {
        List<SpeakerParticipation> speakers = balance != null ? balance.getSpeakers() : new ArrayList<>();
        long meaningfulSpeakers = speakers.stream().filter(s -> s.getPercentage() > MEANINGFUL_SHARE).count();
        boolean reasonable = speakers.size() >= 2 && meaningfulSpeakers >= 2;
        boolean unreasonableDominance = balance != null && balance.getDominantSpeaker() != null
                && speakers.stream()
                        .filter(s -> s.getSpeakerId().equals(balance.getDominantSpeaker()))
                        .anyMatch(s -> s.getPercentage() > UNREASONABLE_DOMINANCE);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("speakerCount", speakers.size());
        details.put("meaningfulSpeakers", meaningfulSpeakers);
        details.put("isBalanced", balance == null || balance.isBalanced());
        details.put("dominantSpeaker", balance != null ? balance.getDominantSpeaker() : null);
        details.put("hasUnreasonableDominance", unreasonableDominance);

        return new QualityCheckResult("participation_balance_reasonableness",
                reasonable && !unreasonableDominance, details);
    }

    QualityCheckResult checkAlertRate(List<DetectedFlag> flags, double durationSeconds) {
        double alertsPerMinute = durationSeconds > 0 ? (flags.size() / durationSeconds) * 60 : 0;
        boolean spammy = alertsPerMinute > MAX_ALERTS_PER_MINUTE;
        Set<String> types = flags.stream().map(flag -> flag.getFlagType().getValue())
                .collect(Collectors.toCollection(TreeSet::new));
        boolean diverse = types.size() > 1 || flags.size() < MIN_ALERTS_FOR_DIVERSITY_CHECK;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalAlerts", flags.size());
        details.put("alertsPerMinute", String.format(Locale.ROOT, "%.2f", alertsPerMinute));
        details.put("durationSeconds", durationSeconds);
        details.put("isSpammy", spammy);
        details.put("alertTypes", new ArrayList<>(types));
        details.put("hasDiversity", diverse);

        return new QualityCheckResult("alert_spam_prevention", !spammy && diverse, details);
    }
}
