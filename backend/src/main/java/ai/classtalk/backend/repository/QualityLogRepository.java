package ai.classtalk.backend.repository;

import ai.classtalk.backend.model.entity.QualityLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface QualityLogRepository extends JpaRepository<QualityLog, UUID> {

    List<QualityLog> findBySessionIdAndLogTypeOrderByCreatedAtAsc(UUID sessionId, String logType);
}
