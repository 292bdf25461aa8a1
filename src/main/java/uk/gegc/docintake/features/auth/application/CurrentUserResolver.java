package uk.gegc.docintake.features.auth.application;

import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.docintake.features.user.domain.model.User;
import uk.gegc.docintake.features.user.domain.repository.UserRepository;
import uk.gegc.docintake.shared.exception.ResourceNotFoundException;
import uk.gegc.docintake.shared.security.CallerIdentity;

/**
 * Maps the Spring Security principal onto the {@link CallerIdentity} that application services expect.
 */
@Component
@RequiredArgsConstructor
public class CurrentUserResolver {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public CallerIdentity resolve(Authentication authentication) {
        String username = authentication.getName();
        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> new ResourceNotFoundException("User " + username + " not found"));
        return new CallerIdentity(user.getId(), user.getUsername(), user.getRole());
    }
}
