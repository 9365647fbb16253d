package uk.gegc.vidstream.features.auth.infra.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import uk.gegc.vidstream.features.auth.application.SessionResolver;
import uk.gegc.vidstream.features.auth.domain.exception.CredentialsInvalidException;
import uk.gegc.vidstream.features.user.domain.model.User;

import java.io.IOException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@Execution(ExecutionMode.SAME_THREAD)
class JwtAuthenticationFilterTest {

    @Mock
    HttpServletRequest httpServletRequest;

    @Mock
    HttpServletResponse httpServletResponse;

    @Mock
    FilterChain filterChain;

    @Mock
    SessionResolver sessionResolver;

    JwtAuthenticationFilter authenticationFilter;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        authenticationFilter = new JwtAuthenticationFilter(sessionResolver);
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("doFilterInternal: no Authorization header leaves the context empty")
    void noHeader() throws ServletException, IOException {
        when(httpServletRequest.getHeader(HttpHeaders.AUTHORIZATION)).thenReturn(null);

        authenticationFilter.doFilterInternal(httpServletRequest, httpServletResponse, filterChain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        verifyNoInteractions(sessionResolver);
        verify(filterChain).doFilter(httpServletRequest, httpServletResponse);
    }

    @Test
    @DisplayName("doFilterInternal: non-bearer scheme is ignored")
    void basicScheme() throws ServletException, IOException {
        when(httpServletRequest.getHeader(HttpHeaders.AUTHORIZATION)).thenReturn("Basic dXNlcjpwYXNz");

        authenticationFilter.doFilterInternal(httpServletRequest, httpServletResponse, filterChain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        verifyNoInteractions(sessionResolver);
        verify(filterChain).doFilter(httpServletRequest, httpServletResponse);
    }

    @Test
    @DisplayName("doFilterInternal: resolved token sets a UserPrincipal with the user's roles")
    void validToken() throws ServletException, IOException {
        User user = new User();
        user.setId(UUID.randomUUID());
        user.setUsername("carol");
        user.setAdmin(true);
        when(httpServletRequest.getHeader(HttpHeaders.AUTHORIZATION)).thenReturn("Bearer good-token");
        when(sessionResolver.resolve("good-token")).thenReturn(user);

        authenticationFilter.doFilterInternal(httpServletRequest, httpServletResponse, filterChain);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getPrincipal()).isInstanceOf(UserPrincipal.class);
        assertThat(((UserPrincipal) authentication.getPrincipal()).getId()).isEqualTo(user.getId());
        assertThat(authentication.getAuthorities())
                .extracting(Object::toString)
                .containsExactlyInAnyOrder(UserPrincipal.ROLE_USER, UserPrincipal.ROLE_ADMIN);
        verify(filterChain).doFilter(httpServletRequest, httpServletResponse);
    }

    @Test
    @DisplayName("doFilterInternal: unresolvable token continues anonymously")
    void invalidToken() throws ServletException, IOException {
        when(httpServletRequest.getHeader(HttpHeaders.AUTHORIZATION)).thenReturn("Bearer bad-token");
        when(httpServletRequest.getRequestURI()).thenReturn("/api/v1/videos");
        when(sessionResolver.resolve("bad-token")).thenThrow(new CredentialsInvalidException("Could not validate credentials"));

        authenticationFilter.doFilterInternal(httpServletRequest, httpServletResponse, filterChain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        verify(filterChain).doFilter(httpServletRequest, httpServletResponse);
    }
}
