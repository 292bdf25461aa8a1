package uk.gegc.docintake.features.storage.application;

import uk.gegc.docintake.features.storage.domain.StoredObject;
import uk.gegc.docintake.features.storage.domain.StoredObjectRef;

/**
 * Durable key to bytes storage with content-type metadata.
 *
 * <p>Implementations must be interchangeable: callers never branch on which one is active.
 * Every {@link #put} generates a fresh unique name, so two uploads of {@code report.pdf}
 * never overwrite each other.</p>
 */
public interface BlobStore {

    /**
     * Stores the bytes under a newly generated unique name derived from {@code name}.
     *
     * @param name      declared file name, used as the suffix of the stored name
     * @param mediaType declared media type; may be {@code null}
     * @param content   bytes to store
     * @return locator for later {@link #get}/{@link #delete}
     * @throws uk.gegc.docintake.shared.exception.DocumentStorageException when the write fails
     */
    StoredObjectRef put(String name, String mediaType, byte[] content);

    /**
     * @throws uk.gegc.docintake.shared.exception.ResourceNotFoundException if nothing is stored under {@code ref}
     */
    StoredObject get(StoredObjectRef ref);

    /**
     * @throws uk.gegc.docintake.shared.exception.ResourceNotFoundException if nothing is stored under {@code ref}
     */
    void delete(StoredObjectRef ref);

    String backendName();
}
