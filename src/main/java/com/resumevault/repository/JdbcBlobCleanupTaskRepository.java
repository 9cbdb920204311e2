package com.resumevault.repository;

import com.resumevault.model.BlobCleanupTask;
import com.resumevault.model.CleanupTaskStatus;
import com.resumevault.model.DeactivatedResume;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcBlobCleanupTaskRepository implements BlobCleanupTaskRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<BlobCleanupTask> taskRowMapper = (rs, rowNum) -> new BlobCleanupTask(
        rs.getObject("id", UUID.class),
        rs.getObject("blob_id", UUID.class),
        rs.getObject("resume_id", UUID.class),
        CleanupTaskStatus.valueOf(rs.getString("status")),
        rs.getInt("attempts"),
        rs.getString("last_error"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    public List<UUID> enqueue(Collection<DeactivatedResume> deactivated) {
        return deactivated.stream()
            .filter(d -> d.blobId() != null)
            .map(d -> jdbcClient.sql("""
                    INSERT INTO blob_cleanup_tasks (blob_id, resume_id, status)
                    VALUES (:blobId, :resumeId, 'PENDING')
                    RETURNING id
                    """)
                .param("blobId", d.blobId())
                .param("resumeId", d.resumeId())
                .query(UUID.class)
                .single())
            .toList();
    }

    @Override
    public Optional<BlobCleanupTask> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM blob_cleanup_tasks WHERE id = :id")
            .param("id", id)
            .query(taskRowMapper)
            .optional();
    }

    @Transactional
    @Override
    public Optional<BlobCleanupTask> claim(UUID id, int maxAttempts) {
        String sql = """
            UPDATE blob_cleanup_tasks
            SET status = 'PROCESSING',
                attempts = attempts + 1,
                updated_at = NOW()
            WHERE id = (
                SELECT id FROM blob_cleanup_tasks
                WHERE id = :id
                  AND status = 'PENDING'
                  AND attempts < :maxAttempts
                FOR UPDATE SKIP LOCKED
            )
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("id", id)
            .param("maxAttempts", maxAttempts)
            .query(taskRowMapper)
            .optional();
    }

    @Override
    public void markDone(UUID id) {
        jdbcClient.sql("""
                UPDATE blob_cleanup_tasks
                SET status = 'DONE', last_error = NULL, updated_at = NOW()
                WHERE id = :id
                """)
            .param("id", id)
            .update();
    }

    @Override
    public void markFailed(UUID id, String error) {
        jdbcClient.sql("""
                UPDATE blob_cleanup_tasks
                SET status = 'FAILED', last_error = :error, updated_at = NOW()
                WHERE id = :id
                """)
            .param("error", error)
            .param("id", id)
            .update();
    }

    @Override
    @Transactional
    public List<UUID> resetStaleAndFailed(int maxAttempts, int staleThresholdMinutes) {
        String sql = """
        UPDATE blob_cleanup_tasks
        SET status = 'PENDING',
            updated_at = NOW()
        WHERE id IN (
            SELECT id
            FROM blob_cleanup_tasks
            WHERE (
                status = 'FAILED'
                OR (status IN ('PENDING', 'PROCESSING') AND updated_at < NOW() - (INTERVAL '1 minute' * :staleMins))
            )
            AND attempts < :maxAttempts
            FOR UPDATE SKIP LOCKED
        )
        RETURNING id
        """;

        return jdbcClient.sql(sql)
            .param("maxAttempts", maxAttempts)
            .param("staleMins", staleThresholdMinutes)
            .query(UUID.class)
            .list();
    }
}
