package ai.classtalk.backend.model.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * DTO representing a request to open a new monitored discussion session.
 */
public class CreateSessionRequest {

    /**
     * Allowed language for the session. Falls back to the deployment default when absent.
     */
    @Size(max = 50, message = "Language must not exceed 50 characters")
    private String language;

    @Size(max = 2000, message = "Topic prompt must not exceed 2000 characters")
    private String topicPrompt;

    @Size(max = 200, message = "At most 200 topic keywords are allowed")
    private List<String> topicKeywords;

    @Valid
    private ParticipationConfig participationConfig;

    public CreateSessionRequest() {
    }

    public CreateSessionRequest(String language, String topicPrompt, List<String> topicKeywords,
                                ParticipationConfig participationConfig) {
        this.language = language;
        this.topicPrompt = topicPrompt;
        this.topicKeywords = topicKeywords;
        this.participationConfig = participationConfig;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getTopicPrompt() {
        return topicPrompt;
    }

    public void setTopicPrompt(String topicPrompt) {
        this.topicPrompt = topicPrompt;
    }

    public List<String> getTopicKeywords() {
        return topicKeywords;
    }

    public void setTopicKeywords(List<String> topicKeywords) {
        this.topicKeywords = topicKeywords;
    }

    public ParticipationConfig getParticipationConfig() {
        return participationConfig;
    }

    public void setParticipationConfig(ParticipationConfig participationConfig) {
        this.participationConfig = participationConfig;
    }
}
