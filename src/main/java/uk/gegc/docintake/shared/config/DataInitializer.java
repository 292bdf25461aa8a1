package uk.gegc.docintake.shared.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.docintake.features.user.config.BootstrapAdminProperties;
import uk.gegc.docintake.features.user.domain.model.User;
import uk.gegc.docintake.features.user.domain.model.UserRole;
import uk.gegc.docintake.features.user.domain.repository.UserRepository;

@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private final BootstrapAdminProperties adminProperties;
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Override
    @Transactional
    public void run(String... args) {
        String password = adminProperties.getPassword();
        if (password == null || password.isBlank()) {
            log.info("No bootstrap admin password configured; skipping admin creation");
            return;
        }
        if (userRepository.existsByUsername(adminProperties.getUsername())) {
            log.debug("Bootstrap admin '{}' already present", adminProperties.getUsername());
            return;
        }

        User admin = new User(
                adminProperties.getUsername(),
                adminProperties.getEmail(),
                passwordEncoder.encode(password),
                UserRole.ADMIN
        );
        userRepository.save(admin);
        log.info("Created bootstrap admin '{}'", admin.getUsername());
    }
}
