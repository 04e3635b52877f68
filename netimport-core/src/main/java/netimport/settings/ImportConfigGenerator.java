package netimport.settings;

import java.security.SecureRandom;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Builds the flat {@code section.key} configuration handed to the import library.
 *
 * <p>Layout of the generated map:
 * <ul>
 *   <li>{@code main.*} defaults, overridable by job options</li>
 *   <li>{@code inventory.address}, {@code inventory.token}, {@code inventory.verify_ssl}</li>
 *   <li>{@code network.login}, {@code network.password}</li>
 *   <li>{@code batfish.*} when a Batfish service is configured, plus generated
 *       {@code batfish.network_name} ({@code BF_NETWORK_<SITE>}) and
 *       {@code batfish.snapshot_name} ({@code BF_SNAPSHOT_<8 chars>})</li>
 *   <li>any remaining job options verbatim</li>
 * </ul>
 *
 * <p>Options may not target the {@code inventory} section or the device login and
 * password; see {@link #isReservedOption(String)}.
 */
public final class ImportConfigGenerator {

  /** Replacement for secrets in logged configuration. */
  public static final String MASK = "********";

  static final Map<String, String> MAIN_DEFAULTS;

  static {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("main.import_ips", "true");
    defaults.put("main.import_prefixes", "true");
    defaults.put("main.import_cabling", "cdp");
    defaults.put("main.import_intf_status", "false");
    defaults.put("main.import_vlans", "cli");
    defaults.put("main.backend", "nautobot");
    defaults.put("main.nbr_workers", "10");
    MAIN_DEFAULTS = Map.copyOf(defaults);
  }

  private static final String SNAPSHOT_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
  private static final int SNAPSHOT_SUFFIX_LENGTH = 8;

  private final Random random;

  public ImportConfigGenerator() {
    this(new SecureRandom());
  }

  ImportConfigGenerator(Random random) {
    this.random = Objects.requireNonNull(random, "random");
  }

  /**
   * Whether a job option key would override a value that must come from resolved settings.
   */
  public static boolean isReservedOption(String key) {
    return key.startsWith("inventory.")
        || key.equals("network.login")
        || key.equals("network.password");
  }

  public Map<String, String> generate(String siteCode, ResolvedSettings settings) {
    Objects.requireNonNull(siteCode, "siteCode");
    Objects.requireNonNull(settings, "settings");

    Map<String, String> config = new LinkedHashMap<>();
    MAIN_DEFAULTS.keySet().stream().sorted()
        .forEach(key -> config.put(key, MAIN_DEFAULTS.get(key)));

    InventorySetting inventory = settings.inventory();
    config.put("inventory.address", inventory.address());
    if (inventory.token() != null) {
      config.put("inventory.token", inventory.token());
    }
    config.put("inventory.verify_ssl", String.valueOf(inventory.verifySsl()));

    config.put("network.login", settings.credentials().login());
    config.put("network.password", settings.credentials().password());

    BatfishSetting batfish = settings.batfish();
    if (batfish != null) {
      putIfSet(config, "batfish.address", batfish.address());
      putIfSet(config, "batfish.port_v1", batfish.portV1());
      putIfSet(config, "batfish.port_v2", batfish.portV2());
      putIfSet(config, "batfish.use_ssl", batfish.useSsl());
    }
    config.put("batfish.network_name", "BF_NETWORK_" + siteCode.toUpperCase(Locale.ROOT));
    config.put("batfish.snapshot_name", "BF_SNAPSHOT_" + snapshotSuffix());

    for (Map.Entry<String, String> option : settings.options().entrySet()) {
      if (isReservedOption(option.getKey())) {
        throw new IllegalArgumentException("Option may not override " + option.getKey());
      }
      config.put(option.getKey(), option.getValue());
    }
    return config;
  }

  /**
   * Copy of {@code config} with the inventory token and device password masked.
   */
  public static Map<String, String> sanitize(Map<String, String> config) {
    Map<String, String> sanitized = new LinkedHashMap<>(config);
    sanitized.computeIfPresent("inventory.token", (k, v) -> MASK);
    sanitized.computeIfPresent("network.password", (k, v) -> MASK);
    return sanitized;
  }

  private String snapshotSuffix() {
    StringBuilder sb = new StringBuilder(SNAPSHOT_SUFFIX_LENGTH);
    synchronized (random) {
      for (int i = 0; i < SNAPSHOT_SUFFIX_LENGTH; i++) {
        sb.append(SNAPSHOT_ALPHABET.charAt(random.nextInt(SNAPSHOT_ALPHABET.length())));
      }
    }
    return sb.toString();
  }

  private static void putIfSet(Map<String, String> config, String key, Object value) {
    if (value != null) {
      config.put(key, String.valueOf(value));
    }
  }
}
