package uk.gegc.docintake.features.auth.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.docintake.features.auth.api.dto.AuthenticatedUserDto;
import uk.gegc.docintake.features.auth.api.dto.JwtResponse;
import uk.gegc.docintake.features.auth.api.dto.LoginRequest;
import uk.gegc.docintake.features.auth.application.AuthService;
import uk.gegc.docintake.features.auth.infra.security.JwtTokenService;
import uk.gegc.docintake.features.user.domain.model.User;
import uk.gegc.docintake.features.user.domain.repository.UserRepository;
import uk.gegc.docintake.shared.exception.ResourceNotFoundException;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthServiceImpl implements AuthService {

    private final AuthenticationManager authManager;
    private final JwtTokenService jwtTokenService;
    private final UserRepository userRepository;

    @Override
    public JwtResponse login(LoginRequest loginRequest) {
        Authentication authentication;
        try {
            authentication = authManager.authenticate(
                    new UsernamePasswordAuthenticationToken(loginRequest.username(), loginRequest.password())
            );
        } catch (AuthenticationException ex) {
            log.info("Failed login attempt for '{}'", loginRequest.username());
            throw new BadCredentialsException("Invalid username or password", ex);
        }

        String accessToken = jwtTokenService.generateAccessToken(authentication);
        return new JwtResponse(accessToken, jwtTokenService.getAccessTokenValidityInMs());
    }

    @Override
    @Transactional(readOnly = true)
    public AuthenticatedUserDto getCurrentUser(Authentication authentication) {
        User user = userRepository.findByUsername(authentication.getName())
                .orElseThrow(() -> new ResourceNotFoundException("User " + authentication.getName() + " not found"));
        return new AuthenticatedUserDto(user.getId(), user.getUsername(), user.getEmail(), user.getRole());
    }
}
