/**
 * Named inventory, credential and Batfish settings, and the translation of a job's
 * selectors into the configuration the import library consumes.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * SettingsResolver resolver = RegistrySettingsResolver.builder()
 *     .inventory(new InventorySetting("lab", "https://nautobot.lab", token, true))
 *     .credentials(new NetworkCredentials("lab-creds", "netops", password))
 *     .batfish(new BatfishSetting("bf", "batfish.lab", 9996, 9997, false))
 *     .build();
 * }</pre>
 */
package netimport.settings;
