package uk.gegc.docintake.features.storage.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;

@Data
@Validated
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

    /**
     * Selects the remote object store. When false, or when the remote store cannot be
     * constructed, files go to the local directory.
     */
    private boolean useRemote = false;

    @Valid
    @NotNull
    private Local local = new Local();

    @Valid
    @NotNull
    private Remote remote = new Remote();

    @Data
    public static class Local {
        /**
         * Directory for stored uploads. Created on first write.
         */
        @NotBlank
        private String rootDir = "uploads";
    }

    @Data
    public static class Remote {

        private String bucket;

        private String region = "us-east-1";

        private String accessKey;

        private String secretKey;

        /**
         * Optional endpoint override for S3-compatible providers.
         * Example: https://lon1.digitaloceanspaces.com
         */
        private URI endpoint;

        /**
         * Path-style addressing, needed by most S3-compatible servers.
         */
        private boolean pathStyleAccess = false;
    }
}
