package com.finledger.config;

import com.finledger.service.JwtService;
import com.finledger.service.LedgerOwner;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the ledger owner from the bearer token. A request without a token passes through
 * anonymous; a request with a token that does not verify or names no owner is answered with 401
 * right here, carrying the reason.
 */
@Component
public class JwtAuthFilter extends OncePerRequestFilter {
  private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final JwtService jwtService;
  private final LedgerAuthenticationEntryPoint entryPoint;
  private final WebAuthenticationDetailsSource detailsSource = new WebAuthenticationDetailsSource();

  public JwtAuthFilter(JwtService jwtService, LedgerAuthenticationEntryPoint entryPoint) {
    this.jwtService = jwtService;
    this.entryPoint = entryPoint;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null || !header.startsWith(BEARER_PREFIX)) {
      filterChain.doFilter(request, response);
      return;
    }

    LedgerOwner owner;
    try {
      owner = jwtService.parseOwner(header.substring(BEARER_PREFIX.length()).trim());
    } catch (AuthenticationException ex) {
      log.warn("Bearer token rejected for {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
      SecurityContextHolder.clearContext();
      entryPoint.commence(request, response, ex);
      return;
    }

    UsernamePasswordAuthenticationToken authentication =
        UsernamePasswordAuthenticationToken.authenticated(owner, null, List.of());
    authentication.setDetails(detailsSource.buildDetails(request));
    SecurityContextHolder.getContext().setAuthentication(authentication);
    filterChain.doFilter(request, response);
  }
}
