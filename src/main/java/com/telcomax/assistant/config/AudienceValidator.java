package com.telcomax.assistant.config;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.util.StringUtils;

/**
 * Accepts a token whose {@code aud} claim names at least one configured audience. With no
 * audience configured every token passes.
 */
class AudienceValidator implements OAuth2TokenValidator<Jwt> {

  private final Set<String> accepted;

  AudienceValidator(Collection<String> audiences) {
    this.accepted = audiences == null ? Set.of() : audiences.stream()
        .filter(StringUtils::hasText)
        .map(String::strip)
        .collect(Collectors.toUnmodifiableSet());
  }

  @Override
  public OAuth2TokenValidatorResult validate(Jwt token) {
    if (accepted.isEmpty()) {
      return OAuth2TokenValidatorResult.success();
    }
    List<String> audience = token.getAudience();
    if (audience != null && audience.stream().anyMatch(accepted::contains)) {
      return OAuth2TokenValidatorResult.success();
    }
    return OAuth2TokenValidatorResult.failure(new OAuth2Error(
        OAuth2ErrorCodes.INVALID_TOKEN, "Token audience " + audience + " not in " + accepted, null));
  }
}
