package netimport.settings;

import netimport.SettingsNotFoundException;
import netimport.model.JobSettings;
import netimport.spi.SettingsResolver;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SettingsResolver} backed by explicit name-keyed maps.
 *
 * <p>When a job names no Batfish setting, the first registered one is used; with none
 * registered the import runs without Batfish configuration.
 *
 * <p>Instances are immutable once built and safe for concurrent use.
 */
public final class RegistrySettingsResolver implements SettingsResolver {
  private final Map<String, InventorySetting> inventories;
  private final Map<String, NetworkCredentials> credentials;
  private final Map<String, BatfishSetting> batfish;

  private RegistrySettingsResolver(Builder builder) {
    this.inventories = Map.copyOf(builder.inventories);
    this.credentials = Map.copyOf(builder.credentials);
    // keep registration order for the default Batfish pick
    this.batfish = Collections.unmodifiableMap(new LinkedHashMap<>(builder.batfish));
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public ResolvedSettings resolve(String siteCode, JobSettings settings) {
    Objects.requireNonNull(settings, "settings");
    InventorySetting inventory = inventories.get(settings.inventory());
    if (inventory == null) {
      throw new SettingsNotFoundException("inventory", settings.inventory());
    }
    NetworkCredentials creds = credentials.get(settings.credentials());
    if (creds == null) {
      throw new SettingsNotFoundException("credentials", settings.credentials());
    }
    BatfishSetting batfishSetting;
    if (settings.batfish() != null) {
      batfishSetting = batfish.get(settings.batfish());
      if (batfishSetting == null) {
        throw new SettingsNotFoundException("batfish", settings.batfish());
      }
    } else {
      batfishSetting = batfish.isEmpty() ? null : batfish.values().iterator().next();
    }
    return new ResolvedSettings(inventory, creds, batfishSetting, settings.options());
  }

  public Collection<InventorySetting> inventories() {
    return inventories.values();
  }

  /** Builder for {@link RegistrySettingsResolver}. */
  public static final class Builder {
    private final Map<String, InventorySetting> inventories = new LinkedHashMap<>();
    private final Map<String, NetworkCredentials> credentials = new LinkedHashMap<>();
    private final Map<String, BatfishSetting> batfish = new LinkedHashMap<>();

    private Builder() {}

    public Builder inventory(InventorySetting setting) {
      register(inventories, setting.name(), setting, "inventory");
      return this;
    }

    public Builder credentials(NetworkCredentials setting) {
      register(credentials, setting.name(), setting, "credentials");
      return this;
    }

    public Builder batfish(BatfishSetting setting) {
      register(batfish, setting.name(), setting, "batfish");
      return this;
    }

    private static <T> void register(Map<String, T> target, String name, T value, String kind) {
      if (target.putIfAbsent(name, value) != null) {
        throw new IllegalArgumentException("Duplicate " + kind + " setting: " + name);
      }
    }

    public RegistrySettingsResolver build() {
      return new RegistrySettingsResolver(this);
    }
  }
}
