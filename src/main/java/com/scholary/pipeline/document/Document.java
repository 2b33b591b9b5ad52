package com.scholary.pipeline.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * A stored document whose text fields processing steps read from and write into.
 *
 * <p>Steps overwrite {@code textContent}, {@code summary} and {@code translatedText} in place.
 * Concurrent jobs on the same document race; the last write wins.
 */
public class Document {

  private String id;
  private String ownerId;
  private String originalName;
  private String filePath;
  private String mimeType;
  private long sizeBytes;
  private String textContent;
  private String language;
  private String summary;
  private String translatedText;
  private String sourceLanguage;
  private Instant createdAt;
  private Instant updatedAt;

  protected Document() {}

  public Document(String id, String ownerId, String originalName, String filePath) {
    this.id = id;
    this.ownerId = ownerId;
    this.originalName = originalName;
    this.filePath = filePath;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  /** Stamp the document as modified. */
  public void touch() {
    this.updatedAt = Instant.now();
  }

  @JsonProperty("id")
  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  @JsonProperty("owner_id")
  public String getOwnerId() {
    return ownerId;
  }

  public void setOwnerId(String ownerId) {
    this.ownerId = ownerId;
  }

  @JsonProperty("original_name")
  public String getOriginalName() {
    return originalName;
  }

  public void setOriginalName(String originalName) {
    this.originalName = originalName;
  }

  @JsonProperty("file_path")
  public String getFilePath() {
    return filePath;
  }

  public void setFilePath(String filePath) {
    this.filePath = filePath;
  }

  @JsonProperty("mime_type")
  public String getMimeType() {
    return mimeType;
  }

  public void setMimeType(String mimeType) {
    this.mimeType = mimeType;
  }

  @JsonProperty("size_bytes")
  public long getSizeBytes() {
    return sizeBytes;
  }

  public void setSizeBytes(long sizeBytes) {
    this.sizeBytes = sizeBytes;
  }

  @JsonProperty("text_content")
  public String getTextContent() {
    return textContent;
  }

  public void setTextContent(String textContent) {
    this.textContent = textContent;
  }

  @JsonProperty("language")
  public String getLanguage() {
    return language;
  }

  public void setLanguage(String language) {
    this.language = language;
  }

  @JsonProperty("summary")
  public String getSummary() {
    return summary;
  }

  public void setSummary(String summary) {
    this.summary = summary;
  }

  @JsonProperty("translated_text")
  public String getTranslatedText() {
    return translatedText;
  }

  public void setTranslatedText(String translatedText) {
    this.translatedText = translatedText;
  }

  @JsonProperty("source_language")
  public String getSourceLanguage() {
    return sourceLanguage;
  }

  public void setSourceLanguage(String sourceLanguage) {
    this.sourceLanguage = sourceLanguage;
  }

  @JsonProperty("created_at")
  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  @JsonProperty("updated_at")
  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
