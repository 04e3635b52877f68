package netimport.spi;

import netimport.model.JobSettings;
import netimport.settings.ResolvedSettings;

/**
 * Turns a job's named selectors into concrete settings.
 *
 * @see netimport.settings.RegistrySettingsResolver
 */
@FunctionalInterface
public interface SettingsResolver {

  /**
   * @param siteCode the job's site
   * @param settings selectors stored with the job
   * @return resolved settings
   * @throws netimport.SettingsNotFoundException if a selector names nothing registered
   */
  ResolvedSettings resolve(String siteCode, JobSettings settings);
}
