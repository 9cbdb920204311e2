package com.resumevault.service;

import com.resumevault.controller.ResumeDetail;
import com.resumevault.controller.ResumeSummary;
import com.resumevault.controller.ResumeUpdateRequest;
import com.resumevault.event.BlobCleanupRequestedEvent;
import com.resumevault.exception.PermissionDeniedException;
import com.resumevault.exception.ResumeNotFoundException;
import com.resumevault.ingestion.MetadataNormalizer;
import com.resumevault.model.DeactivatedResume;
import com.resumevault.model.Resume;
import com.resumevault.model.ResumeFilters;
import com.resumevault.model.Tag;
import com.resumevault.model.TagKind;
import com.resumevault.repository.BlobCleanupTaskRepository;
import com.resumevault.repository.ResumeRepository;
import com.resumevault.repository.TagRepository;
import com.resumevault.security.ResumePrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeServiceImpl implements ResumeService {

    private final ResumeRepository resumeRepository;
    private final TagRepository tagRepository;
    private final BlobCleanupTaskRepository cleanupTaskRepository;
    private final TagResolver tagResolver;
    private final ResumeResponseMapper mapper;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional(readOnly = true)
    public ResumeDetail getById(String rawId) {
        UUID id = ResumeIds.parse(rawId);
        return resumeRepository.findActiveById(id)
            .map(mapper::toDetail)
            .orElseThrow(() -> new ResumeNotFoundException(id));
    }

    @Override
    @Transactional
    public ResumeSummary update(String rawId, ResumeUpdateRequest request, ResumePrincipal principal) {
        UUID id = ResumeIds.parse(rawId);
        Resume current = lockForChange(id, principal);

        resumeRepository.updateFields(id,
            valueOrCurrent(request.name(), current.name()),
            valueOrCurrent(request.major(), current.major()),
            valueOrCurrent(request.graduationYear(), current.graduationYear()));

        if (hasText(request.companies())) {
            List<Tag> companies = tagResolver.resolveAll(TagKind.COMPANY, MetadataNormalizer.splitCsv(request.companies()));
            resumeRepository.replaceTags(id, TagKind.COMPANY, companies.stream().map(Tag::id).toList());
        }
        if (hasText(request.keywords())) {
            List<Tag> keywords = tagResolver.resolveAll(TagKind.KEYWORD, MetadataNormalizer.splitCsv(request.keywords()));
            resumeRepository.replaceTags(id, TagKind.KEYWORD, keywords.stream().map(Tag::id).toList());
        }

        log.info("Resume {} updated by {}", id, principal.id());
        return resumeRepository.findActiveById(id)
            .map(mapper::toSummary)
            .orElseThrow(() -> new ResumeNotFoundException(id));
    }

    /**
     * Flips the soft-delete flag and queues the blob for removal in the same transaction. The blob
     * itself is deleted asynchronously after commit.
     */
    @Override
    @Transactional
    public void delete(String rawId, ResumePrincipal principal) {
        UUID id = ResumeIds.parse(rawId);
        lockForChange(id, principal);

        DeactivatedResume deactivated = resumeRepository.deactivate(id)
            .orElseThrow(() -> new ResumeNotFoundException(id));
        List<UUID> taskIds = cleanupTaskRepository.enqueue(List.of(deactivated));
        eventPublisher.publishEvent(new BlobCleanupRequestedEvent(taskIds));

        log.info("Resume {} soft-deleted by {}, blob {} queued for cleanup", id, principal.id(), deactivated.blobId());
    }

    @Override
    @Transactional
    public int deleteAll(ResumePrincipal principal) {
        if (principal == null || !principal.isAdmin()) {
            throw new PermissionDeniedException("Permission denied. Admin access required.");
        }

        List<DeactivatedResume> deactivated = resumeRepository.deactivateAll();
        if (deactivated.isEmpty()) {
            throw new ResumeNotFoundException("No active resumes found to delete.");
        }

        List<UUID> taskIds = cleanupTaskRepository.enqueue(deactivated);
        eventPublisher.publishEvent(new BlobCleanupRequestedEvent(taskIds));

        log.info("Admin {} soft-deleted {} resumes, {} blobs queued for cleanup",
            principal.id(), deactivated.size(), taskIds.size());
        return deactivated.size();
    }

    @Override
    @Transactional(readOnly = true)
    public ResumeFilters filters() {
        return new ResumeFilters(
            resumeRepository.findDistinctActiveMajors(),
            resumeRepository.findDistinctActiveGraduationYears(),
            tagRepository.findNamesReferencedByActiveResumes(TagKind.COMPANY),
            tagRepository.findNamesReferencedByActiveResumes(TagKind.KEYWORD)
        );
    }

    /**
     * A missing resume is reported before a permission problem.
     */
    private Resume lockForChange(UUID id, ResumePrincipal principal) {
        Resume resume = resumeRepository.lockActiveById(id)
            .orElseThrow(() -> new ResumeNotFoundException(id));
        if (principal == null || !(principal.isAdmin() || resume.isOwnedBy(principal.id()))) {
            throw new PermissionDeniedException("Permission denied.");
        }
        return resume;
    }

    private static String valueOrCurrent(String value, String current) {
        return hasText(value) ? value.trim() : current;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
