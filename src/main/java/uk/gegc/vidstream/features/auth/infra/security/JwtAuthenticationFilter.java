package uk.gegc.vidstream.features.auth.infra.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;
import uk.gegc.vidstream.features.auth.application.SessionResolver;
import uk.gegc.vidstream.features.auth.domain.exception.CredentialsInvalidException;
import uk.gegc.vidstream.features.user.domain.model.User;

import java.io.IOException;

/**
 * Resolves the {@code Authorization: Bearer} header into a {@link UserPrincipal}. A request whose
 * token cannot be resolved continues anonymously, so protected endpoints answer 401 through the
 * security entry point.
 */
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionResolver sessionResolver;

    public JwtAuthenticationFilter(SessionResolver sessionResolver) {
        this.sessionResolver = sessionResolver;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response, @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length()).trim();
            try {
                User user = sessionResolver.resolve(token);
                UserPrincipal principal = new UserPrincipal(user);
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities());
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("Successfully authenticated user: {}", user.getUsername());
            } catch (CredentialsInvalidException ex) {
                log.warn("Invalid bearer token received from IP: {}, URI: {}, User-Agent: {}",
                        request.getRemoteAddr(),
                        request.getRequestURI(),
                        request.getHeader(HttpHeaders.USER_AGENT));
            }
        }

        filterChain.doFilter(request, response);
    }
}
