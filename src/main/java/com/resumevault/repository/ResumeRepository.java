package com.resumevault.repository;

import com.resumevault.model.DeactivatedResume;
import com.resumevault.model.Resume;
import com.resumevault.model.TagKind;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public interface ResumeRepository {
    Resume save(Resume resume);
    Optional<Resume> findActiveById(UUID id);
    Optional<Resume> lockActiveById(UUID id);
    void updateFields(UUID id, String name, String major, String graduationYear);
    void replaceTags(UUID id, TagKind kind, List<UUID> tagIds);
    Optional<DeactivatedResume> deactivate(UUID id);
    List<DeactivatedResume> deactivateAll();
    List<Resume> search(ResumeQuery query);
    List<String> findDistinctActiveMajors();
    List<String> findDistinctActiveGraduationYears();
    Set<UUID> findBlobIdsReferencedByActive(Collection<UUID> blobIds);
    long countActive();
}
