package netimport.settings;

import java.util.Map;
import java.util.Objects;

/**
 * Settings with every selector resolved to its concrete values.
 *
 * @param inventory   resolved inventory
 * @param credentials resolved device credentials
 * @param batfish     resolved Batfish service, or {@code null} if none is configured
 * @param options     import option overrides copied from the job
 */
public record ResolvedSettings(
    InventorySetting inventory,
    NetworkCredentials credentials,
    BatfishSetting batfish,
    Map<String, String> options
) {
  public ResolvedSettings {
    Objects.requireNonNull(inventory, "inventory");
    Objects.requireNonNull(credentials, "credentials");
    options = options == null ? Map.of() : Map.copyOf(options);
  }
}
