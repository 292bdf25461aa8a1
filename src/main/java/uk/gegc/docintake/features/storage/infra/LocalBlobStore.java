package uk.gegc.docintake.features.storage.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import uk.gegc.docintake.features.storage.application.BlobStore;
import uk.gegc.docintake.features.storage.application.MediaTypes;
import uk.gegc.docintake.features.storage.domain.StoredObject;
import uk.gegc.docintake.features.storage.domain.StoredObjectRef;
import uk.gegc.docintake.shared.exception.DocumentStorageException;
import uk.gegc.docintake.shared.exception.ResourceNotFoundException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Filesystem backed store. Objects live flat under the root directory, which is created on first write.
 * The media type is kept in a {@code .meta} sidecar next to each object.
 */
@Slf4j
public class LocalBlobStore implements BlobStore {

    static final String SCHEME = "local";
    private static final String META_SUFFIX = ".meta";

    private final Path root;

    public LocalBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public StoredObjectRef put(String name, String mediaType, byte[] content) {
        String uniqueName = UUID.randomUUID() + "_" + safeName(name);
        Path target = root.resolve(uniqueName);
        String effectiveType = mediaType == null || mediaType.isBlank()
                ? MediaTypes.inferFromFileName(name)
                : mediaType;

        try {
            Files.createDirectories(root);
            // CREATE_NEW: a name collision must fail rather than overwrite
            Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            Files.writeString(metaPath(target), effectiveType, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to store file " + name + " on local disk", e);
        }

        log.debug("Stored {} bytes at {}", content.length, target);
        return new StoredObjectRef(SCHEME + "://" + root.getFileName() + "/" + uniqueName);
    }

    @Override
    public StoredObject get(StoredObjectRef ref) {
        Path path = resolve(ref);
        try {
            byte[] content = Files.readAllBytes(path);
            return new StoredObject(content, readMediaType(path));
        } catch (NoSuchFileException e) {
            throw new ResourceNotFoundException("Stored object " + ref + " not found", e);
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to read stored object " + ref, e);
        }
    }

    @Override
    public void delete(StoredObjectRef ref) {
        Path path = resolve(ref);
        try {
            if (!Files.deleteIfExists(path)) {
                throw new ResourceNotFoundException("Stored object " + ref + " not found");
            }
            Files.deleteIfExists(metaPath(path));
        } catch (IOException e) {
            throw new DocumentStorageException("Failed to delete stored object " + ref, e);
        }
        log.debug("Deleted {}", path);
    }

    @Override
    public String backendName() {
        return "local:" + root;
    }

    private Path resolve(StoredObjectRef ref) {
        if (!SCHEME.equals(ref.scheme())) {
            throw new ResourceNotFoundException("Stored object " + ref + " not found");
        }
        String path = ref.path();
        String uniqueName = path.substring(path.lastIndexOf('/') + 1);
        Path resolved = root.resolve(uniqueName).normalize();
        if (uniqueName.isBlank() || !resolved.getParent().equals(root)) {
            throw new ResourceNotFoundException("Stored object " + ref + " not found");
        }
        return resolved;
    }

    private String readMediaType(Path objectPath) throws IOException {
        Path meta = metaPath(objectPath);
        if (Files.exists(meta)) {
            return Files.readString(meta, StandardCharsets.UTF_8).trim();
        }
        String storedName = objectPath.getFileName().toString();
        return MediaTypes.inferFromFileName(storedName);
    }

    private static Path metaPath(Path objectPath) {
        return objectPath.resolveSibling(objectPath.getFileName() + META_SUFFIX);
    }

    private static String safeName(String name) {
        String base = FilenameUtils.getName(name == null ? "" : name);
        return base.isBlank() ? "file" : base;
    }
}
