package com.resumevault.service;

import com.resumevault.model.Tag;
import com.resumevault.model.TagKind;
import com.resumevault.repository.TagRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class TagResolverImpl implements TagResolver {

    private final TagRepository tagRepository;

    @Override
    public Tag resolve(TagKind kind, String name) {
        String canonical = TagNameNormalizer.normalize(kind, name);
        if (canonical.isEmpty()) {
            throw new IllegalArgumentException(kind + " name must not be blank");
        }
        return tagRepository.upsert(kind, canonical);
    }

    @Override
    public List<Tag> resolveAll(TagKind kind, List<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of();
        }
        return names.stream()
            .map(name -> resolve(kind, name))
            .toList();
    }

    @Override
    public List<Tag> resolveBestEffort(TagKind kind, List<String> names, String logContext) {
        if (names == null || names.isEmpty()) {
            log.info("[{}] No {} names to resolve.", logContext, kind);
            return List.of();
        }

        log.info("[{}] Finding/creating {} unique {} names...", logContext, names.size(), kind);
        List<Tag> resolved = new ArrayList<>(names.size());
        for (String name : names) {
            try {
                resolved.add(resolve(kind, name));
            } catch (RuntimeException e) {
                log.error("[{}] Error resolving {} '{}': {}. Continuing without it.",
                    logContext, kind, name, e.getMessage(), e);
            }
        }
        log.info("[{}] Resolved {} of {} {} names.", logContext, resolved.size(), names.size(), kind);
        return resolved;
    }

    @Override
    public List<Tag> findMatching(TagKind kind, Collection<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return List.of();
        }
        return tagRepository.findByNameContainingAny(kind, fragments);
    }
}
