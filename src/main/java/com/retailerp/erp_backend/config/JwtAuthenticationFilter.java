package com.retailerp.erp_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailerp.erp_backend.exception.GlobalExceptionHandler;
import com.retailerp.erp_backend.exception.UnauthorizedException;
import com.retailerp.erp_backend.security.JwtTokenProvider;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.security.TenantResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String COMPANY_HEADER = "X-Company-ID";

    private final JwtTokenProvider jwtTokenProvider;
    private final TenantResolver tenantResolver;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String token = getJwtFromRequest(request);
        if (token == null) {
            filterChain.doFilter(request, response);
            return;
        }

        Optional<UUID> userId = jwtTokenProvider.resolveUserId(token);
        if (userId.isEmpty()) {
            // unauthenticated, the entry point answers 401
            filterChain.doFilter(request, response);
            return;
        }

        TenantContext tenant;
        try {
            tenant = tenantResolver.resolve(userId.get(), request.getHeader(COMPANY_HEADER));
        } catch (UnauthorizedException e) {
            log.warn("Tenant resolution failed for user {}: {}", userId.get(), e.getMessage());
            writeUnauthorized(request, response, e.getMessage());
            return;
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                tenant, null, List.of(new SimpleGrantedAuthority("ROLE_" + tenant.getRole().name())));
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    private String getJwtFromRequest(HttpServletRequest request) {
        String bearerToken = request.getHeader("Authorization");
        if (StringUtils.hasText(bearerToken) && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }

    private void writeUnauthorized(HttpServletRequest request, HttpServletResponse response,
                                   String message) throws IOException {
        GlobalExceptionHandler.ErrorResponse error = GlobalExceptionHandler.ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.UNAUTHORIZED.value())
                .error(HttpStatus.UNAUTHORIZED.getReasonPhrase())
                .message(message)
                .errorCode("UNAUTHORIZED")
                .path("uri=" + request.getRequestURI())
                .build();

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
