package uk.gegc.docintake.features.auth.infra.security;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import uk.gegc.docintake.BaseUnitTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JwtAuthenticationFilterTest extends BaseUnitTest {

    @Mock
    private JwtTokenService jwtTokenService;

    @Mock
    private FilterChain filterChain;

    private JwtAuthenticationFilter filter;
    private final MockHttpServletResponse response = new MockHttpServletResponse();

    @BeforeEach
    void setUp() {
        filter = new JwtAuthenticationFilter(jwtTokenService);
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("Bearer header with a valid token sets the authentication")
    void bearerHeader_valid() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/documents");
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer good");
        Authentication authentication = mock(Authentication.class);
        when(jwtTokenService.validateToken("good")).thenReturn(true);
        when(jwtTokenService.getAuthentication("good")).thenReturn(authentication);

        filter.doFilterInternal(request, response, filterChain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isSameAs(authentication);
        verify(filterChain).doFilter(request, response);
    }

    @Test
    void bearerHeader_invalid_leavesContextEmpty() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/documents");
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer bad");
        when(jwtTokenService.validateToken("bad")).thenReturn(false);

        filter.doFilterInternal(request, response, filterChain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        verify(jwtTokenService, never()).getAuthentication(anyString());
        verify(filterChain).doFilter(request, response);
    }

    @Test
    @DisplayName("query token is honoured on live-stream paths only")
    void queryToken_onlyForLivePaths() throws Exception {
        MockHttpServletRequest live = new MockHttpServletRequest("GET", "/ws/events");
        live.setParameter("access_token", "good");
        Authentication authentication = mock(Authentication.class);
        when(jwtTokenService.validateToken("good")).thenReturn(true);
        when(jwtTokenService.getAuthentication("good")).thenReturn(authentication);

        filter.doFilterInternal(live, response, filterChain);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isSameAs(authentication);

        SecurityContextHolder.clearContext();
        MockHttpServletRequest api = new MockHttpServletRequest("GET", "/api/v1/documents");
        api.setParameter("access_token", "good");

        filter.doFilterInternal(api, response, filterChain);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }
}
