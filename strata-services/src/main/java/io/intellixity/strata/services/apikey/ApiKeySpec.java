package io.intellixity.strata.services.apikey;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Input to the {@link ApiKeyService} create operations. */
public record ApiKeySpec(String name,
                         String ownerId,
                         List<String> scopes,
                         Instant expiresAt,
                         Integer rateLimit,
                         Map<String, Object> metadata) {
  public static ApiKeySpec of(String name, String ownerId, List<String> scopes) {
    return new ApiKeySpec(name, ownerId, scopes, null, null, Map.of());
  }

  public ApiKeySpec expiringAt(Instant at) {
    return new ApiKeySpec(name, ownerId, scopes, at, rateLimit, metadata);
  }
}
