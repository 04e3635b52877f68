package netimport.server.web;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import netimport.dispatch.JobRequest;
import netimport.model.JobSettings;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of {@code POST /api/execute/}. Unknown keys are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecuteRequest(String site, String mode, Settings settings) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Settings(Named inventory, Network network, Named batfish, Map<String, Object> options) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Named(String name) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Network(@JsonProperty("credentials_name") String credentialsName) {
    }

    /**
     * Converts to a dispatcher request. Missing sections map to {@code null} names,
     * which the dispatcher rejects.
     */
    public JobRequest toJobRequest() {
        if (settings == null) {
            return new JobRequest(site, mode, null);
        }
        String inventory = settings.inventory() != null ? settings.inventory().name() : null;
        String credentials = settings.network() != null ? settings.network().credentialsName() : null;
        String batfish = settings.batfish() != null ? settings.batfish().name() : null;
        Map<String, String> options = new LinkedHashMap<>();
        if (settings.options() != null) {
            settings.options().forEach((k, v) -> options.put(k, v == null ? null : String.valueOf(v)));
        }
        return new JobRequest(site, mode, new JobSettings(inventory, credentials, batfish, options));
    }
}
