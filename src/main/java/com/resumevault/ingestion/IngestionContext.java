package com.resumevault.ingestion;

import com.resumevault.model.Resume;
import com.resumevault.model.ResumeDraft;
import com.resumevault.model.Tag;
import com.resumevault.security.ResumePrincipal;
import com.resumevault.storage.BlobDescriptor;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * State shared by the write-side steps of one ingestion.
 */
@Getter
@Setter
class IngestionContext {

    private final String originalFilename;
    private final byte[] content;
    private final ResumePrincipal uploader;
    private final ResumeDraft draft;

    private BlobDescriptor blob;
    private List<Tag> companies = List.of();
    private List<Tag> keywords = List.of();
    private Resume saved;

    IngestionContext(String originalFilename, byte[] content, ResumePrincipal uploader, ResumeDraft draft) {
        this.originalFilename = originalFilename;
        this.content = content;
        this.uploader = uploader;
        this.draft = draft;
    }
}
