package com.finledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finledger.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.CredentialsExpiredException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/** Renders 401s in the same body shape as every other API error. */
@Component
public class LedgerAuthenticationEntryPoint implements AuthenticationEntryPoint {
  static final String MISSING_TOKEN = "Missing bearer token";

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public LedgerAuthenticationEntryPoint(ObjectMapper objectMapper, Clock clock) {
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    HttpStatus status = HttpStatus.UNAUTHORIZED;
    ErrorResponse body = new ErrorResponse(
        clock.instant(), status.value(), status.getReasonPhrase(), reason(authException));
    response.setStatus(status.value());
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), body);
  }

  private String reason(AuthenticationException ex) {
    // token problems carry their own reason; anything else means no usable token was sent
    if (ex instanceof BadCredentialsException || ex instanceof CredentialsExpiredException) {
      return ex.getMessage();
    }
    return MISSING_TOKEN;
  }
}
