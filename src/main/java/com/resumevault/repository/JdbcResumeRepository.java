package com.resumevault.repository;

import com.resumevault.exception.ResumeNotFoundException;
import com.resumevault.model.DeactivatedResume;
import com.resumevault.model.Resume;
import com.resumevault.model.Tag;
import com.resumevault.model.TagKind;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcResumeRepository implements ResumeRepository {

    private final JdbcClient jdbcClient;

    private final JdbcTemplate jdbcTemplate;

    private final TagRepository tagRepository;

    private final RowMapper<Resume> resumeRowMapper = (rs, rowNum) -> new Resume(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        rs.getString("major"),
        rs.getString("graduation_year"),
        rs.getObject("blob_id", UUID.class),
        rs.getString("uploaded_by"),
        List.of(),
        List.of(),
        rs.getBoolean("is_active"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    private final RowMapper<DeactivatedResume> deactivatedRowMapper = (rs, rowNum) -> new DeactivatedResume(
        rs.getObject("id", UUID.class),
        rs.getObject("blob_id", UUID.class)
    );

    @Override
    public Resume save(Resume resume) {
        Resume saved = jdbcClient.sql("""
                INSERT INTO resumes (name, major, graduation_year, blob_id, uploaded_by)
                VALUES (:name, :major, :graduationYear, :blobId, :uploadedBy)
                RETURNING *
                """)
            .param("name", resume.name())
            .param("major", resume.major())
            .param("graduationYear", resume.graduationYear())
            .param("blobId", resume.blobId())
            .param("uploadedBy", resume.uploadedBy())
            .query(resumeRowMapper)
            .single();

        List<Tag> companies = distinctById(resume.companies());
        List<Tag> keywords = distinctById(resume.keywords());
        insertLinks(saved.id(), TagKind.COMPANY, companies.stream().map(Tag::id).toList());
        insertLinks(saved.id(), TagKind.KEYWORD, keywords.stream().map(Tag::id).toList());

        return saved.withTags(companies, keywords);
    }

    @Override
    public Optional<Resume> findActiveById(UUID id) {
        return jdbcClient.sql("SELECT * FROM resumes WHERE id = :id AND is_active = TRUE")
            .param("id", id)
            .query(resumeRowMapper)
            .optional()
            .map(this::withTags);
    }

    @Override
    public Optional<Resume> lockActiveById(UUID id) {
        return jdbcClient.sql("SELECT * FROM resumes WHERE id = :id AND is_active = TRUE FOR UPDATE")
            .param("id", id)
            .query(resumeRowMapper)
            .optional()
            .map(this::withTags);
    }

    @Override
    public void updateFields(UUID id, String name, String major, String graduationYear) {
        String sql = """
            UPDATE resumes
            SET name = :name,
                major = :major,
                graduation_year = :graduationYear,
                updated_at = NOW()
            WHERE id = :id AND is_active = TRUE
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("name", name)
            .param("major", major)
            .param("graduationYear", graduationYear)
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new ResumeNotFoundException(id);
        }
    }

    @Override
    public void replaceTags(UUID id, TagKind kind, List<UUID> tagIds) {
        jdbcClient.sql("DELETE FROM %s WHERE resume_id = :id".formatted(kind.linkTable()))
            .param("id", id)
            .update();
        insertLinks(id, kind, new ArrayList<>(new LinkedHashSet<>(tagIds)));
        jdbcClient.sql("UPDATE resumes SET updated_at = NOW() WHERE id = :id")
            .param("id", id)
            .update();
    }

    private void insertLinks(UUID resumeId, TagKind kind, List<UUID> tagIds) {
        if (tagIds.isEmpty()) {
            return;
        }

        String sql = "INSERT INTO %s (resume_id, %s, position) VALUES (?, ?, ?)"
            .formatted(kind.linkTable(), kind.linkColumn());

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                ps.setObject(1, resumeId);
                ps.setObject(2, tagIds.get(i));
                ps.setInt(3, i);
            }

            @Override
            public int getBatchSize() {
                return tagIds.size();
            }
        });
    }

    @Override
    public Optional<DeactivatedResume> deactivate(UUID id) {
        return jdbcClient.sql("""
                UPDATE resumes
                SET is_active = FALSE, updated_at = NOW()
                WHERE id = :id AND is_active = TRUE
                RETURNING id, blob_id
                """)
            .param("id", id)
            .query(deactivatedRowMapper)
            .optional();
    }

    @Override
    public List<DeactivatedResume> deactivateAll() {
        return jdbcClient.sql("""
                UPDATE resumes
                SET is_active = FALSE, updated_at = NOW()
                WHERE is_active = TRUE
                RETURNING id, blob_id
                """)
            .query(deactivatedRowMapper)
            .list();
    }

    @Override
    public List<Resume> search(ResumeQuery query) {
        List<Resume> rows = jdbcClient.sql(query.sql())
            .params(query.params())
            .query(resumeRowMapper)
            .list();

        if (rows.isEmpty()) {
            return rows;
        }

        List<UUID> ids = rows.stream().map(Resume::id).toList();
        Map<UUID, List<Tag>> companies = tagRepository.findByResumeIds(TagKind.COMPANY, ids);
        Map<UUID, List<Tag>> keywords = tagRepository.findByResumeIds(TagKind.KEYWORD, ids);

        return rows.stream()
            .map(r -> r.withTags(
                companies.getOrDefault(r.id(), List.of()),
                keywords.getOrDefault(r.id(), List.of())))
            .toList();
    }

    @Override
    public List<String> findDistinctActiveMajors() {
        return jdbcClient.sql("""
                SELECT DISTINCT major FROM resumes
                WHERE is_active = TRUE AND major <> ''
                ORDER BY major
                """)
            .query(String.class)
            .list();
    }

    @Override
    public List<String> findDistinctActiveGraduationYears() {
        return jdbcClient.sql("""
                SELECT DISTINCT graduation_year FROM resumes
                WHERE is_active = TRUE AND graduation_year <> ''
                ORDER BY graduation_year
                """)
            .query(String.class)
            .list();
    }

    @Override
    public Set<UUID> findBlobIdsReferencedByActive(Collection<UUID> blobIds) {
        if (blobIds == null || blobIds.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(jdbcClient.sql("""
                SELECT DISTINCT blob_id FROM resumes
                WHERE is_active = TRUE AND blob_id IN (:blobIds)
                """)
            .param("blobIds", blobIds)
            .query(UUID.class)
            .list());
    }

    @Override
    public long countActive() {
        return jdbcClient.sql("SELECT COUNT(*) FROM resumes WHERE is_active = TRUE")
            .query(Long.class)
            .single();
    }

    private Resume withTags(Resume resume) {
        List<UUID> ids = List.of(resume.id());
        return resume.withTags(
            tagRepository.findByResumeIds(TagKind.COMPANY, ids).getOrDefault(resume.id(), List.of()),
            tagRepository.findByResumeIds(TagKind.KEYWORD, ids).getOrDefault(resume.id(), List.of())
        );
    }

    private static List<Tag> distinctById(List<Tag> tags) {
        if (tags == null) {
            return List.of();
        }
        Set<UUID> seen = new HashSet<>();
        return tags.stream()
            .filter(tag -> seen.add(tag.id()))
            .toList();
    }
}
