package netimport.testing;

import netimport.model.JobSettings;
import netimport.settings.BatfishSetting;
import netimport.settings.InventorySetting;
import netimport.settings.NetworkCredentials;
import netimport.settings.RegistrySettingsResolver;

/**
 * Shared settings for tests.
 */
public final class Fixtures {

  private Fixtures() {}

  public static RegistrySettingsResolver resolver() {
    return RegistrySettingsResolver.builder()
        .inventory(new InventorySetting("nautobot", "https://nautobot.example.net", "secret-token", true))
        .credentials(new NetworkCredentials("lab", "admin", "hunter2"))
        .batfish(new BatfishSetting("bf", "batfish.example.net", 9996, 9997, false))
        .build();
  }

  public static JobSettings settings() {
    return JobSettings.of("nautobot", "lab");
  }
}
