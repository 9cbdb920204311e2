package com.resumevault.repository;

import com.resumevault.model.Tag;
import com.resumevault.model.TagKind;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
public class JdbcTagRepository implements TagRepository {

    private final JdbcClient jdbcClient;

    private static RowMapper<Tag> tagRowMapper(TagKind kind) {
        return (rs, rowNum) -> new Tag(rs.getObject("id", UUID.class), kind, rs.getString("name"));
    }

    /**
     * Insert-if-absent guarded by the unique name constraint. A concurrent insert of the same name makes
     * {@code ON CONFLICT} skip the row, in which case the winner's row is read back.
     * <p>
     * Always runs in its own transaction, and each retry attempt gets a fresh one, independent of any
     * transaction the caller holds.
     */
    @Override
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 50))
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Tag upsert(TagKind kind, String name) {
        String sql = """
            INSERT INTO %s (name)
            VALUES (:name)
            ON CONFLICT (name) DO NOTHING
            RETURNING id, name
            """.formatted(kind.table());

        return jdbcClient.sql(sql)
            .param("name", name)
            .query(tagRowMapper(kind))
            .optional()
            .or(() -> findByName(kind, name))
            .orElseThrow(() -> new IllegalStateException(
                "Tag '%s' vanished between conflict and re-read".formatted(name)));
    }

    @Override
    public Optional<Tag> findByName(TagKind kind, String name) {
        return jdbcClient.sql("SELECT id, name FROM %s WHERE name = :name".formatted(kind.table()))
            .param("name", name)
            .query(tagRowMapper(kind))
            .optional();
    }

    @Override
    public List<Tag> findByNameContainingAny(TagKind kind, Collection<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return List.of();
        }

        String[] patterns = fragments.stream()
            .map(LikePatterns::containing)
            .toArray(String[]::new);

        return jdbcClient.sql("""
                SELECT id, name FROM %s
                WHERE name ILIKE ANY (:patterns)
                ORDER BY name
                """.formatted(kind.table()))
            .param("patterns", patterns)
            .query(tagRowMapper(kind))
            .list();
    }

    @Override
    public Map<UUID, List<Tag>> findByResumeIds(TagKind kind, Collection<UUID> resumeIds) {
        if (resumeIds == null || resumeIds.isEmpty()) {
            return Map.of();
        }

        String sql = """
            SELECT l.resume_id, t.id, t.name
            FROM %s l
            JOIN %s t ON t.id = l.%s
            WHERE l.resume_id IN (:resumeIds)
            ORDER BY l.resume_id, l.position
            """.formatted(kind.linkTable(), kind.table(), kind.linkColumn());

        record Link(UUID resumeId, Tag tag) {}

        return jdbcClient.sql(sql)
            .param("resumeIds", resumeIds)
            .query((rs, rowNum) -> new Link(
                rs.getObject("resume_id", UUID.class),
                new Tag(rs.getObject("id", UUID.class), kind, rs.getString("name"))))
            .list()
            .stream()
            .collect(Collectors.groupingBy(Link::resumeId, LinkedHashMap::new,
                Collectors.mapping(Link::tag, Collectors.toList())));
    }

    @Override
    public List<String> findNamesReferencedByActiveResumes(TagKind kind) {
        String sql = """
            SELECT DISTINCT t.name
            FROM %s t
            JOIN %s l ON l.%s = t.id
            JOIN resumes r ON r.id = l.resume_id
            WHERE r.is_active = TRUE AND t.name <> ''
            ORDER BY t.name
            """.formatted(kind.table(), kind.linkTable(), kind.linkColumn());

        return jdbcClient.sql(sql)
            .query(String.class)
            .list();
    }

    @Override
    public long count(TagKind kind, String name) {
        return jdbcClient.sql("SELECT COUNT(*) FROM %s WHERE name = :name".formatted(kind.table()))
            .param("name", name)
            .query(Long.class)
            .single();
    }
}
