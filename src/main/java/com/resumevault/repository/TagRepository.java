package com.resumevault.repository;

import com.resumevault.model.Tag;
import com.resumevault.model.TagKind;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface TagRepository {
    Tag upsert(TagKind kind, String name);
    Optional<Tag> findByName(TagKind kind, String name);
    List<Tag> findByNameContainingAny(TagKind kind, Collection<String> fragments);
    Map<UUID, List<Tag>> findByResumeIds(TagKind kind, Collection<UUID> resumeIds);
    List<String> findNamesReferencedByActiveResumes(TagKind kind);
    long count(TagKind kind, String name);
}
