package uk.gegc.docintake.features.storage.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.docintake.features.storage.domain.StoredObject;
import uk.gegc.docintake.features.storage.domain.StoredObjectRef;
import uk.gegc.docintake.shared.exception.ResourceNotFoundException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalBlobStoreTest {

    @TempDir
    Path tempDir;

    private Path root;
    private LocalBlobStore store;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("uploads");
        store = new LocalBlobStore(root);
    }

    @Test
    @DisplayName("put creates the root directory lazily and get returns bytes and media type")
    void put_thenGet_returnsStoredBytes() {
        assertThat(root).doesNotExist();

        StoredObjectRef ref = store.put("report.pdf", "application/pdf", "pdf-bytes".getBytes(StandardCharsets.UTF_8));

        assertThat(root).isDirectory();
        assertThat(ref.scheme()).isEqualTo("local");
        assertThat(ref.value()).startsWith("local://uploads/").endsWith("_report.pdf");

        StoredObject stored = store.get(ref);
        assertThat(stored.content()).isEqualTo("pdf-bytes".getBytes(StandardCharsets.UTF_8));
        assertThat(stored.mediaType()).isEqualTo("application/pdf");
    }

    @Test
    @DisplayName("two uploads with the same name never overwrite each other")
    void put_sameNameTwice_keepsBothObjects() {
        StoredObjectRef first = store.put("notes.txt", "text/plain", "one".getBytes(StandardCharsets.UTF_8));
        StoredObjectRef second = store.put("notes.txt", "text/plain", "two".getBytes(StandardCharsets.UTF_8));

        assertThat(first).isNotEqualTo(second);
        assertThat(store.get(first).content()).isEqualTo("one".getBytes(StandardCharsets.UTF_8));
        assertThat(store.get(second).content()).isEqualTo("two".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("missing media type is inferred from the extension")
    void put_withoutMediaType_infersFromExtension() {
        StoredObjectRef ref = store.put("photo.PNG", null, new byte[]{1, 2, 3});

        assertThat(store.get(ref).mediaType()).isEqualTo("image/png");
    }

    @Test
    @DisplayName("delete removes the object and a second delete reports not found")
    void delete_thenDeleteAgain_throwsNotFound() throws Exception {
        StoredObjectRef ref = store.put("a.txt", "text/plain", "x".getBytes(StandardCharsets.UTF_8));

        store.delete(ref);

        try (var files = Files.list(root)) {
            assertThat(files).isEmpty();
        }
        assertThatThrownBy(() -> store.delete(ref)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> store.get(ref)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("refs pointing outside the root or at another scheme are not found")
    void get_foreignOrTraversalRef_throwsNotFound() {
        assertThatThrownBy(() -> store.get(new StoredObjectRef("s3://bucket/key")))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> store.get(new StoredObjectRef("local://uploads/..")))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
