package com.scholary.pipeline.objectstore;

import java.util.Optional;

/** A {@code s3://bucket/key} reference to a stored object. */
public record ObjectReference(String bucket, String key) {

  private static final String SCHEME = "s3://";

  /**
   * Parse a file reference.
   *
   * @return the bucket and key, or empty if the reference is not an object store reference
   */
  public static Optional<ObjectReference> parse(String reference) {
    if (reference == null || !reference.startsWith(SCHEME)) {
      return Optional.empty();
    }
    String rest = reference.substring(SCHEME.length());
    int slash = rest.indexOf('/');
    if (slash <= 0 || slash == rest.length() - 1) {
      throw new IllegalArgumentException("Malformed object reference: " + reference);
    }
    return Optional.of(new ObjectReference(rest.substring(0, slash), rest.substring(slash + 1)));
  }

  @Override
  public String toString() {
    return SCHEME + bucket + "/" + key;
  }
}
