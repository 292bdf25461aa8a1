package uk.gegc.docintake.features.auth.application;

import org.springframework.security.core.Authentication;
import uk.gegc.docintake.features.auth.api.dto.AuthenticatedUserDto;
import uk.gegc.docintake.features.auth.api.dto.JwtResponse;
import uk.gegc.docintake.features.auth.api.dto.LoginRequest;

public interface AuthService {

    JwtResponse login(LoginRequest loginRequest);

    AuthenticatedUserDto getCurrentUser(Authentication authentication);
}
