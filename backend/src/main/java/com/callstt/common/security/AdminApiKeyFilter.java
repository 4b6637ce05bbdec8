package com.callstt.common.security;

import com.callstt.common.exception.UnauthorizedException;
import com.callstt.common.util.Hashing;
import com.callstt.config.AppProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

@Component
public class AdminApiKeyFilter extends OncePerRequestFilter {

    public static final String KEY_HEADER = "X-Admin-Key";
    public static final String ACTOR_HEADER = "X-Admin-Actor";
    static final String DEFAULT_ACTOR = "admin";

    private final AppProperties appProperties;

    public AdminApiKeyFilter(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String provided = request.getHeader(KEY_HEADER);
        if (provided == null) {
            filterChain.doFilter(request, response);
            return;
        }

        try {
            String configured = appProperties.admin() == null ? null : appProperties.admin().apiKey();
            if (configured == null || configured.isBlank() || !Hashing.constantTimeEquals(configured, provided)) {
                throw new UnauthorizedException("Invalid admin API key");
            }

            String actor = request.getHeader(ACTOR_HEADER);
            AdminActor adminActor = new AdminActor(actor == null || actor.isBlank() ? DEFAULT_ACTOR : actor.trim());
            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    adminActor,
                    null,
                    List.of(new SimpleGrantedAuthority("ROLE_ADMIN"))
            );
            SecurityContextHolder.getContext().setAuthentication(authentication);
        } catch (UnauthorizedException exception) {
            SecurityContextHolder.clearContext();
        }

        filterChain.doFilter(request, response);
    }
}
