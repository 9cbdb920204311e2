package com.resumevault.service;

import com.resumevault.controller.ResumeDetail;
import com.resumevault.controller.ResumeSummary;
import com.resumevault.controller.UploadedResumeResponse;
import com.resumevault.model.Resume;
import com.resumevault.model.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class ResumeResponseMapper {

    private final FileDeliveryService fileDeliveryService;

    public ResumeSummary toSummary(Resume resume) {
        return new ResumeSummary(
            resume.id(),
            resume.name(),
            resume.major(),
            resume.graduationYear(),
            fileDeliveryService.fileUrlFor(resume.id()),
            names(resume.companies()),
            names(resume.keywords())
        );
    }

    public ResumeDetail toDetail(Resume resume) {
        return new ResumeDetail(
            resume.id(),
            resume.name(),
            resume.major(),
            resume.graduationYear(),
            fileDeliveryService.fileUrlFor(resume.id()),
            names(resume.companies()),
            names(resume.keywords()),
            resume.uploadedBy() == null ? null : new ResumeDetail.Uploader(resume.uploadedBy()),
            resume.createdAt(),
            resume.updatedAt()
        );
    }

    public UploadedResumeResponse toUploaded(Resume resume, String parsingWarning) {
        return new UploadedResumeResponse(
            resume.id(),
            resume.name(),
            resume.major(),
            resume.graduationYear(),
            parsingWarning,
            names(resume.companies()),
            names(resume.keywords()),
            fileDeliveryService.fileUrlFor(resume.id())
        );
    }

    private static List<String> names(List<Tag> tags) {
        if (tags == null) {
            return List.of();
        }
        return tags.stream().map(Tag::name).toList();
    }
}
