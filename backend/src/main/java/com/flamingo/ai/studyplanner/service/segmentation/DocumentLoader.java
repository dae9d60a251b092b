package com.flamingo.ai.studyplanner.service.segmentation;

/**
 * Turns raw document bytes into a {@link LoadedDocument}.
 *
 * <p>Implementations are format-specific and stateless so a single instance can serve every
 * planner session.
 */
public interface DocumentLoader {

  /**
   * Loads the document.
   *
   * @param content raw document bytes
   * @param fileName bare filename, used for logging and identity
   * @return page texts and outline
   * @throws com.flamingo.ai.studyplanner.exception.DocumentProcessingException if the document
   *     cannot be opened
   */
  LoadedDocument load(byte[] content, String fileName);

  /**
   * Returns {@code true} if this loader can handle the given MIME type.
   *
   * @param mimeType detected MIME type
   * @return {@code true} if supported
   */
  boolean supports(String mimeType);
}
