package uk.gegc.docintake.features.user.application;

import uk.gegc.docintake.features.upload.domain.UploadedBlob;

public interface UserImportService {

    /**
     * Creates accounts from a CSV payload with the header {@code Username,Email,Password,Role}.
     * Invalid rows are counted and reported; all valid rows are stored in a single commit.
     *
     * @throws uk.gegc.docintake.shared.exception.FatalPersistenceException if the batch commit fails
     */
    ImportOutcome importUsers(UploadedBlob csv);
}
