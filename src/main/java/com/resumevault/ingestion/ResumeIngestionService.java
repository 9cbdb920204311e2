package com.resumevault.ingestion;

import com.resumevault.exception.DatabaseException;
import com.resumevault.exception.IngestionException;
import com.resumevault.exception.StorageException;
import com.resumevault.extraction.ContentExtractionException;
import com.resumevault.extraction.ExtractedResume;
import com.resumevault.extraction.ResumeContentExtractor;
import com.resumevault.model.ResumeDraft;
import com.resumevault.model.TagKind;
import com.resumevault.repository.ResumeRepository;
import com.resumevault.service.TagResolver;
import com.resumevault.storage.BlobStore;
import com.resumevault.storage.FilenameSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Write path for new resumes.
 * <p>
 * Validation, extraction and normalization have no side effects. Blob upload, tag resolution and
 * the metadata commit then run as a {@link Saga}: if anything fails after the blob was written,
 * the blob is deleted again before the error is reported. The blob write is not part of the
 * metadata transaction, so a process crash between the two still leaves an orphan blob; the
 * orphan sweep reclaims those.
 */
@Slf4j
@Service
public class ResumeIngestionService {

    private final UploadValidator validator;
    private final ResumeContentExtractor extractor;
    private final MetadataNormalizer normalizer;
    private final BlobStore blobStore;
    private final TagResolver tagResolver;
    private final ResumeRepository resumeRepository;
    private final TransactionTemplate transactionTemplate;

    public ResumeIngestionService(
        UploadValidator validator,
        ResumeContentExtractor extractor,
        MetadataNormalizer normalizer,
        BlobStore blobStore,
        TagResolver tagResolver,
        ResumeRepository resumeRepository,
        PlatformTransactionManager transactionManager
    ) {
        this.validator = validator;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.blobStore = blobStore;
        this.tagResolver = tagResolver;
        this.resumeRepository = resumeRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public IngestionResult ingest(IngestionRequest request) {
        UploadedFile file = request.file();
        String filename = file == null ? "Unnamed file" : file.displayName();
        log.info("[{}] Starting resume upload. Size: {} bytes", filename, file == null ? "unknown" : file.size());

        validator.validate(file);

        String fallbackName = fileStem(file.originalFilename());

        log.info("[{}] Parsing resume...", filename);
        ExtractedResume extracted;
        String parsingWarning = null;
        try {
            extracted = extractor.extract(file.content(), fallbackName);
            log.info("[{}] Parsing successful. Extracted name: {}", filename, extracted.name());
        } catch (ContentExtractionException | RuntimeException e) {
            parsingWarning = e.getMessage() != null ? e.getMessage() : "Unknown parsing error";
            log.error("[{}] Error during resume parsing: {}. Using fallback data.", filename, parsingWarning, e);
            extracted = ExtractedResume.fallback(fallbackName);
        }

        ResumeDraft draft;
        try {
            draft = normalizer.normalize(request, extracted, fallbackName);
        } catch (RuntimeException e) {
            log.error("[{}] Upload failed at step: {}. Error: {}", filename,
                IngestionStage.DATA_PROCESSING.label(), e.getMessage(), e);
            throw new IngestionException(IngestionStage.DATA_PROCESSING, IngestionException.Category.UNEXPECTED,
                filename, e);
        }

        IngestionContext context = new IngestionContext(file.originalFilename(), file.content(),
            request.uploader(), draft);
        try {
            writeSaga(filename).run(context);
        } catch (SagaExecutionException e) {
            log.error("[{}] Upload failed at step: {}. Error: {}", filename, e.getFailedStage().label(),
                e.getCause().getMessage());
            throw new IngestionException(e.getFailedStage(), categorize(e), filename, e.getCause());
        }

        log.info("[{}] Transaction committed. Upload complete. ID: {}", filename, context.getSaved().id());
        return new IngestionResult(context.getSaved(), filename, parsingWarning);
    }

    private Saga<IngestionContext> writeSaga(String filename) {
        return new Saga<>(filename, List.of(
            SagaStep.of(IngestionStage.BLOB_UPLOAD, this::uploadBlob, this::deleteUploadedBlob),
            SagaStep.of(IngestionStage.ASSOCIATE_COMPANIES, ctx -> ctx.setCompanies(
                tagResolver.resolveBestEffort(TagKind.COMPANY, ctx.getDraft().companies(), filename))),
            SagaStep.of(IngestionStage.ASSOCIATE_KEYWORDS, ctx -> ctx.setKeywords(
                tagResolver.resolveBestEffort(TagKind.KEYWORD, ctx.getDraft().keywords(), filename))),
            SagaStep.of(IngestionStage.DATABASE_CREATE, this::commitMetadata)
        ));
    }

    private void uploadBlob(IngestionContext ctx) {
        String original = ctx.getOriginalFilename();
        String safeFilename = FilenameSanitizer.sanitize(original == null || original.isBlank()
            ? "resume_" + System.currentTimeMillis() + ".pdf"
            : original, FilenameSanitizer.MAX_STORED_LENGTH);
        log.info("[{}] Uploading file to blob store as: {}", original, safeFilename);
        ctx.setBlob(blobStore.store(ctx.getContent(), safeFilename, MediaType.APPLICATION_PDF_VALUE));
        log.info("[{}] Blob upload successful. blobId: {}", original, ctx.getBlob().id());
    }

    private void deleteUploadedBlob(IngestionContext ctx) {
        if (ctx.getBlob() == null) {
            return;
        }
        boolean deleted = blobStore.delete(ctx.getBlob().id());
        log.info("[{}] Removed uploaded blob {} after failed upload (found: {})",
            ctx.getOriginalFilename(), ctx.getBlob().id(), deleted);
    }

    private void commitMetadata(IngestionContext ctx) {
        log.info("[{}] Creating database record...", ctx.getOriginalFilename());
        try {
            ctx.setSaved(transactionTemplate.execute(status -> resumeRepository.save(
                ctx.getDraft().toResume(ctx.getBlob().id(), ctx.getUploader().id(), ctx.getCompanies(),
                    ctx.getKeywords()))));
        } catch (DataAccessException | TransactionException e) {
            throw new DatabaseException("Database create failed: " + e.getMessage(), e);
        }
    }

    private static IngestionException.Category categorize(SagaExecutionException e) {
        if (e.getCause() instanceof StorageException) {
            return IngestionException.Category.STORAGE;
        }
        if (e.getCause() instanceof DatabaseException) {
            return IngestionException.Category.DATABASE;
        }
        return IngestionException.Category.UNEXPECTED;
    }

    static String fileStem(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            return "Resume_" + System.currentTimeMillis();
        }
        return originalFilename.replaceFirst("\\.[^/.]+$", "");
    }
}
