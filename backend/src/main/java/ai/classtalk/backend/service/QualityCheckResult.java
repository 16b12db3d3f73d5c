package ai.classtalk.backend.service;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QualityCheckResult {

    private String checkName;
    private boolean passed;
    private Map<String, Object> details;
}
