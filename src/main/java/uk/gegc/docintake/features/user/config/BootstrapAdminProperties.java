package uk.gegc.docintake.features.user.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Administrator account created on startup so that bulk import can be used on a fresh database.
 * Leaving the password blank disables the bootstrap.
 */
@Data
@ConfigurationProperties(prefix = "app.bootstrap.admin")
public class BootstrapAdminProperties {

    private String username = "admin";

    private String email = "admin@docintake.local";

    private String password;
}
