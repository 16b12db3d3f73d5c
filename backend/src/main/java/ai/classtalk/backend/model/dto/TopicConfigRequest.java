package ai.classtalk.backend.model.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicConfigRequest {

    @Size(max = 2000, message = "Topic prompt must not exceed 2000 characters")
    private String topicPrompt;

    @Size(max = 200, message = "At most 200 topic keywords are allowed")
    private List<String> topicKeywords;
}
