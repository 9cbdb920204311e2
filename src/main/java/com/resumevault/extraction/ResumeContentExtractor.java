package com.resumevault.extraction;

/**
 * Best-effort metadata extraction from raw resume bytes. Implementations may fail for any reason;
 * callers treat failure as non-fatal.
 */
public interface ResumeContentExtractor {

    /**
     * @param content      raw PDF bytes, already validated
     * @param fallbackName filename without extension, used when no name can be found
     * @throws ContentExtractionException if nothing usable could be read
     */
    ExtractedResume extract(byte[] content, String fallbackName) throws ContentExtractionException;
}
