package io.b2mash.credits.user;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Where the engine finds users. Identifiers are validated at startup; {@code segments} maps a
 * custom targeting name to a SQL boolean expression over the user table.
 */
@ConfigurationProperties(prefix = "credits.users")
public record UserDirectoryProperties(
    @DefaultValue("users") String table,
    @DefaultValue("id") String idColumn,
    @DefaultValue("created_at") String registeredAtColumn,
    @DefaultValue("last_activity_at") String lastActivityColumn,
    Map<String, String> segments) {

  public UserDirectoryProperties {
    segments = segments == null ? Map.of() : Map.copyOf(segments);
  }
}
