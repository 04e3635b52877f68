package netimport.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named selectors chosen by the caller for a job, plus free-form import options.
 *
 * <p>Only names are stored with the job. Addresses, tokens and passwords are looked
 * up through a {@link netimport.spi.SettingsResolver} when the job runs.
 *
 * @param inventory   name of the inventory setting (required)
 * @param credentials name of the network credentials (required)
 * @param batfish     name of the Batfish setting, or {@code null} for the default
 * @param options     import option overrides keyed {@code section.key}, never {@code null}
 */
public record JobSettings(
    String inventory,
    String credentials,
    String batfish,
    Map<String, String> options
) {
  private static final String INVENTORY_KEY = "inventory";
  private static final String CREDENTIALS_KEY = "credentials";
  private static final String BATFISH_KEY = "batfish";
  private static final String OPTION_PREFIX = "option.";

  public JobSettings {
    options = options == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(options));
  }

  public static JobSettings of(String inventory, String credentials) {
    return new JobSettings(inventory, credentials, null, Map.of());
  }

  public JobSettings withBatfish(String batfish) {
    return new JobSettings(inventory, credentials, batfish, options);
  }

  public JobSettings withOptions(Map<String, String> options) {
    return new JobSettings(inventory, credentials, batfish, options);
  }

  /**
   * Flattens these settings into a string map suitable for a JSON column.
   */
  public Map<String, String> toMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(INVENTORY_KEY, inventory);
    map.put(CREDENTIALS_KEY, credentials);
    if (batfish != null) {
      map.put(BATFISH_KEY, batfish);
    }
    options.forEach((k, v) -> map.put(OPTION_PREFIX + k, v));
    return map;
  }

  /**
   * Inverse of {@link #toMap()}.
   */
  public static JobSettings fromMap(Map<String, String> map) {
    Objects.requireNonNull(map, "map");
    Map<String, String> options = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : map.entrySet()) {
      if (entry.getKey().startsWith(OPTION_PREFIX)) {
        options.put(entry.getKey().substring(OPTION_PREFIX.length()), entry.getValue());
      }
    }
    return new JobSettings(map.get(INVENTORY_KEY), map.get(CREDENTIALS_KEY), map.get(BATFISH_KEY), options);
  }
}
