package com.finledger.config;

import java.util.Arrays;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableWebSecurity
public class SecurityConfig {
  static final String CHANGE_STREAM = "/api/ledger/changes";

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http, JwtAuthFilter jwtAuthFilter,
                                                 LedgerAuthenticationEntryPoint entryPoint) throws Exception {
    http
        .csrf(csrf -> csrf.disable())
        .cors(Customizer.withDefaults())
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers("/actuator/health").permitAll()
            .anyRequest().authenticated())
        .exceptionHandling(ex -> ex.authenticationEntryPoint(entryPoint))
        .addFilterBefore(jwtAuthFilter, UsernamePasswordAuthenticationFilter.class);
    return http.build();
  }

  /**
   * The change stream is read-only and reconnects with {@code Last-Event-ID}; the rest of the
   * ledger API accepts writes.
   */
  @Bean
  public CorsConfigurationSource corsConfigurationSource(
      @Value("${finledger.app.frontend-url:http://localhost:8081}") String frontendUrl) {
    List<String> origins = Arrays.stream(frontendUrl.split(","))
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .toList();

    CorsConfiguration stream = baseCors(origins);
    stream.setAllowedMethods(List.of("GET"));
    stream.setAllowedHeaders(List.of("Authorization", "Last-Event-ID", "Cache-Control"));

    CorsConfiguration api = baseCors(origins);
    api.setAllowedMethods(List.of("GET", "POST", "PATCH", "DELETE", "OPTIONS"));
    api.setAllowedHeaders(List.of("Authorization", "Content-Type"));

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration(CHANGE_STREAM, stream);
    source.registerCorsConfiguration("/api/ledger/**", api);
    return source;
  }

  private static CorsConfiguration baseCors(List<String> origins) {
    CorsConfiguration config = new CorsConfiguration();
    config.setAllowedOrigins(origins);
    config.setAllowCredentials(true);
    config.setMaxAge(3600L);
    return config;
  }
}
