package netimport.server.web;

import jakarta.servlet.http.HttpServletRequest;

import java.security.Principal;

/**
 * Resolves who submitted a request: the authenticated principal, else the configured
 * header, else {@value #ANONYMOUS}.
 */
final class Principals {

    static final String ANONYMOUS = "anonymous";

    private Principals() {
    }

    static String resolve(HttpServletRequest request, String header) {
        Principal principal = request.getUserPrincipal();
        if (principal != null && principal.getName() != null && !principal.getName().isBlank()) {
            return principal.getName();
        }
        if (header != null && !header.isBlank()) {
            String value = request.getHeader(header);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return ANONYMOUS;
    }
}
