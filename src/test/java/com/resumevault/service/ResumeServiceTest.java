package com.resumevault.service;

import com.resumevault.controller.ResumeDetail;
import com.resumevault.controller.ResumeSummary;
import com.resumevault.controller.ResumeUpdateRequest;
import com.resumevault.event.BlobCleanupRequestedEvent;
import com.resumevault.exception.PermissionDeniedException;
import com.resumevault.exception.ResumeNotFoundException;
import com.resumevault.exception.ValidationException;
import com.resumevault.model.DeactivatedResume;
import com.resumevault.model.Resume;
import com.resumevault.model.ResumeFilters;
import com.resumevault.model.Tag;
import com.resumevault.model.TagKind;
import com.resumevault.repository.BlobCleanupTaskRepository;
import com.resumevault.repository.ResumeRepository;
import com.resumevault.repository.TagRepository;
import com.resumevault.security.ResumePrincipal;
import com.resumevault.security.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResumeServiceTest {

    private static final ResumePrincipal OWNER = new ResumePrincipal("owner", Role.USER);
    private static final ResumePrincipal STRANGER = new ResumePrincipal("stranger", Role.USER);
    private static final ResumePrincipal ADMIN = new ResumePrincipal("admin", Role.ADMIN);

    @Mock
    private ResumeRepository resumeRepository;

    @Mock
    private TagRepository tagRepository;

    @Mock
    private BlobCleanupTaskRepository cleanupTaskRepository;

    @Mock
    private TagResolver tagResolver;

    @Mock
    private ResumeResponseMapper mapper;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private ResumeServiceImpl resumeService;

    @Nested
    @DisplayName("Get by id")
    class GetById {

        @Test
        @DisplayName("Malformed id is a validation error")
        void malformedId() {
            assertThatThrownBy(() -> resumeService.getById("not-a-uuid"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid resume ID.");
            assertThatThrownBy(() -> resumeService.getById("1-1-1-1-1"))
                .isInstanceOf(ValidationException.class);
            verifyNoInteractions(resumeRepository);
        }

        @Test
        @DisplayName("Missing or inactive resume is not found")
        void notFound() {
            UUID id = UUID.randomUUID();
            when(resumeRepository.findActiveById(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> resumeService.getById(id.toString()))
                .isInstanceOf(ResumeNotFoundException.class)
                .hasMessage("Resume not found.");
        }

        @Test
        @DisplayName("Active resume is mapped to its detail view")
        void found() {
            Resume resume = resume("owner");
            ResumeDetail detail = new ResumeDetail(resume.id(), "Alice", "CS", "2024", "/f", List.of(), List.of(),
                new ResumeDetail.Uploader("owner"), resume.createdAt(), resume.updatedAt());
            when(resumeRepository.findActiveById(resume.id())).thenReturn(Optional.of(resume));
            when(mapper.toDetail(resume)).thenReturn(detail);

            assertThat(resumeService.getById(resume.id().toString())).isEqualTo(detail);
        }
    }

    @Nested
    @DisplayName("Update")
    class Update {

        @Test
        @DisplayName("Not found is reported before permission")
        void notFoundBeforeForbidden() {
            UUID id = UUID.randomUUID();
            when(resumeRepository.lockActiveById(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> resumeService.update(id.toString(), emptyUpdate(), STRANGER))
                .isInstanceOf(ResumeNotFoundException.class);
        }

        @Test
        @DisplayName("Non-owner non-admin is denied without changes")
        void strangerDenied() {
            Resume resume = resume("owner");
            when(resumeRepository.lockActiveById(resume.id())).thenReturn(Optional.of(resume));

            assertThatThrownBy(() -> resumeService.update(resume.id().toString(), emptyUpdate(), STRANGER))
                .isInstanceOf(PermissionDeniedException.class)
                .hasMessage("Permission denied.");
            verify(resumeRepository, never()).updateFields(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Blank fields keep stored values and present tag lists replace the current ones")
        void partialUpdate() {
            Resume resume = resume("owner");
            Tag globex = new Tag(UUID.randomUUID(), TagKind.COMPANY, "Globex");
            when(resumeRepository.lockActiveById(resume.id())).thenReturn(Optional.of(resume));
            when(tagResolver.resolveAll(TagKind.COMPANY, List.of("globex"))).thenReturn(List.of(globex));
            when(resumeRepository.findActiveById(resume.id())).thenReturn(Optional.of(resume));
            when(mapper.toSummary(resume)).thenReturn(summary(resume));

            resumeService.update(resume.id().toString(),
                new ResumeUpdateRequest(" ", "Physics ", null, "globex", ""), OWNER);

            verify(resumeRepository).updateFields(resume.id(), "Alice", "Physics", "2024");
            verify(resumeRepository).replaceTags(resume.id(), TagKind.COMPANY, List.of(globex.id()));
            verify(resumeRepository, never()).replaceTags(eq(resume.id()), eq(TagKind.KEYWORD), anyList());
        }

        @Test
        @DisplayName("Admin may update any resume")
        void adminAllowed() {
            Resume resume = resume("owner");
            when(resumeRepository.lockActiveById(resume.id())).thenReturn(Optional.of(resume));
            when(resumeRepository.findActiveById(resume.id())).thenReturn(Optional.of(resume));
            when(mapper.toSummary(resume)).thenReturn(summary(resume));

            resumeService.update(resume.id().toString(), new ResumeUpdateRequest("New", null, null, null, null), ADMIN);

            verify(resumeRepository).updateFields(resume.id(), "New", "CS", "2024");
        }
    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        @DisplayName("Owner soft-deletes and queues the blob for cleanup")
        void ownerDeletes() {
            Resume resume = resume("owner");
            UUID taskId = UUID.randomUUID();
            DeactivatedResume deactivated = new DeactivatedResume(resume.id(), resume.blobId());
            when(resumeRepository.lockActiveById(resume.id())).thenReturn(Optional.of(resume));
            when(resumeRepository.deactivate(resume.id())).thenReturn(Optional.of(deactivated));
            when(cleanupTaskRepository.enqueue(List.of(deactivated))).thenReturn(List.of(taskId));

            resumeService.delete(resume.id().toString(), OWNER);

            verify(eventPublisher).publishEvent(new BlobCleanupRequestedEvent(List.of(taskId)));
        }

        @Test
        @DisplayName("Stranger cannot delete")
        void strangerDenied() {
            Resume resume = resume("owner");
            when(resumeRepository.lockActiveById(resume.id())).thenReturn(Optional.of(resume));

            assertThatThrownBy(() -> resumeService.delete(resume.id().toString(), STRANGER))
                .isInstanceOf(PermissionDeniedException.class);
            verify(resumeRepository, never()).deactivate(any());
            verifyNoInteractions(cleanupTaskRepository, eventPublisher);
        }
    }

    @Nested
    @DisplayName("Delete all")
    class DeleteAll {

        @Test
        @DisplayName("Requires an admin")
        void requiresAdmin() {
            assertThatThrownBy(() -> resumeService.deleteAll(OWNER))
                .isInstanceOf(PermissionDeniedException.class)
                .hasMessage("Permission denied. Admin access required.");
            verifyNoInteractions(resumeRepository);
        }

        @Test
        @DisplayName("Nothing active is not found")
        void nothingActive() {
            when(resumeRepository.deactivateAll()).thenReturn(List.of());

            assertThatThrownBy(() -> resumeService.deleteAll(ADMIN))
                .isInstanceOf(ResumeNotFoundException.class)
                .hasMessage("No active resumes found to delete.");
            verifyNoInteractions(cleanupTaskRepository, eventPublisher);
        }

        @Test
        @DisplayName("Deactivates everything and queues every blob")
        void deactivatesAll() {
            List<DeactivatedResume> deactivated = List.of(
                new DeactivatedResume(UUID.randomUUID(), UUID.randomUUID()),
                new DeactivatedResume(UUID.randomUUID(), UUID.randomUUID()));
            List<UUID> taskIds = List.of(UUID.randomUUID(), UUID.randomUUID());
            when(resumeRepository.deactivateAll()).thenReturn(deactivated);
            when(cleanupTaskRepository.enqueue(deactivated)).thenReturn(taskIds);

            assertThat(resumeService.deleteAll(ADMIN)).isEqualTo(2);
            verify(eventPublisher).publishEvent(new BlobCleanupRequestedEvent(taskIds));
        }
    }

    @Test
    @DisplayName("Filters combine distinct fields and referenced tag names")
    void filters() {
        when(resumeRepository.findDistinctActiveMajors()).thenReturn(List.of("CS", "Physics"));
        when(resumeRepository.findDistinctActiveGraduationYears()).thenReturn(List.of("2023", "2024"));
        when(tagRepository.findNamesReferencedByActiveResumes(TagKind.COMPANY)).thenReturn(List.of("Acme Corp"));
        when(tagRepository.findNamesReferencedByActiveResumes(TagKind.KEYWORD)).thenReturn(List.of("Java"));

        assertThat(resumeService.filters()).isEqualTo(new ResumeFilters(
            List.of("CS", "Physics"), List.of("2023", "2024"), List.of("Acme Corp"), List.of("Java")));
    }

    private static ResumeSummary summary(Resume resume) {
        return new ResumeSummary(resume.id(), resume.name(), resume.major(), resume.graduationYear(),
            "/resumes/" + resume.id() + "/file", List.of(), List.of());
    }

    private static ResumeUpdateRequest emptyUpdate() {
        return new ResumeUpdateRequest(null, null, null, null, null);
    }

    private static Resume resume(String owner) {
        OffsetDateTime now = OffsetDateTime.now();
        return new Resume(UUID.randomUUID(), "Alice", "CS", "2024", UUID.randomUUID(), owner,
            List.of(), List.of(), true, now, now);
    }
}
