package com.scholary.pipeline.document;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class CaffeineDocumentStoreTest {

  private final CaffeineDocumentStore store = new CaffeineDocumentStore(100);

  @Test
  void testFindByIdAndOwner_HidesOtherOwnersDocuments() {
    store.save(new Document("doc-1", "alice", "a.txt", "/data/a.txt"));

    assertThat(store.findByIdAndOwner("doc-1", "alice")).isPresent();
    assertThat(store.findByIdAndOwner("doc-1", "bob")).isEmpty();
    assertThat(store.findById("missing")).isEmpty();
  }

  @Test
  void testFindRecentByOwner_NewestFirstAndLimited() {
    Document older = new Document("doc-1", "alice", "a.txt", "/data/a.txt");
    older.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
    Document newer = new Document("doc-2", "alice", "b.txt", "/data/b.txt");
    newer.setCreatedAt(Instant.parse("2024-02-01T00:00:00Z"));
    store.save(older);
    store.save(newer);
    store.save(new Document("doc-3", "bob", "c.txt", "/data/c.txt"));

    assertThat(store.findRecentByOwner("alice", 10))
        .extracting(Document::getId)
        .containsExactly("doc-2", "doc-1");
    assertThat(store.findRecentByOwner("alice", 1)).hasSize(1);
    assertThat(store.countByOwner("alice")).isEqualTo(2);
  }

  @Test
  void testSave_ReplacesStoredDocument() {
    Document document = new Document("doc-1", "alice", "a.txt", "/data/a.txt");
    store.save(document);

    document.setSummary("short");
    store.save(document);

    assertThat(store.findById("doc-1")).get().extracting(Document::getSummary).isEqualTo("short");
  }
}
