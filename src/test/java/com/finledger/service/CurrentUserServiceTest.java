package com.finledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ResponseStatusException;

@DisplayName("CurrentUserService")
class CurrentUserServiceTest {
  private final CurrentUserService service = new CurrentUserService();

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
  }

  @Test
  @DisplayName("returns the owner placed by the token filter")
  void authenticated() {
    UUID userId = UUID.randomUUID();
    SecurityContextHolder.getContext().setAuthentication(
        new UsernamePasswordAuthenticationToken(new LedgerOwner(userId), null, List.of()));

    assertThat(service.requireOwner()).isEqualTo(new LedgerOwner(userId));
    assertThat(service.requireUserId()).isEqualTo(userId);
  }

  @Test
  @DisplayName("a principal that is not a ledger owner gets 401")
  void foreignPrincipal() {
    SecurityContextHolder.getContext().setAuthentication(
        new UsernamePasswordAuthenticationToken(UUID.randomUUID().toString(), null, List.of()));

    assertThatThrownBy(service::requireOwner)
        .isInstanceOf(ResponseStatusException.class)
        .hasMessageContaining("Missing bearer token");
  }

  @Test
  @DisplayName("anonymous callers get 401")
  void anonymous() {
    SecurityContextHolder.getContext().setAuthentication(new AnonymousAuthenticationToken(
        "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS")));

    assertThatThrownBy(service::requireUserId)
        .isInstanceOf(ResponseStatusException.class)
        .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED));
  }

  @Test
  @DisplayName("no authentication at all gets 401")
  void missing() {
    assertThatThrownBy(service::requireUserId).isInstanceOf(ResponseStatusException.class);
  }
}
