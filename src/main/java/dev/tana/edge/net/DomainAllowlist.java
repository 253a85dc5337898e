package dev.tana.edge.net;

import java.util.List;
import java.util.Locale;

/**
 * Hostname allowlist: a host passes when it equals an entry or ends with {@code "." + entry}.
 */
public final class DomainAllowlist {
    public static final List<String> DEFAULT_DOMAINS = List.of(
        "pokeapi.co",
        "tana.dev",
        "api.tana.dev",
        "blockchain.tana.dev",
        "localhost",
        "127.0.0.1"
    );

    private final List<String> domains;

    public DomainAllowlist(List<String> domains) {
        if (domains == null || domains.isEmpty()) {
            throw new IllegalArgumentException("allowlist must contain at least one domain");
        }
        this.domains = domains.stream()
            .map(domain -> domain.trim().toLowerCase(Locale.ROOT))
            .filter(domain -> !domain.isEmpty())
            .distinct()
            .toList();
    }

    public static DomainAllowlist defaults() {
        return new DomainAllowlist(DEFAULT_DOMAINS);
    }

    public boolean allows(String hostname) {
        if (hostname == null || hostname.isEmpty()) {
            return false;
        }
        String host = hostname.toLowerCase(Locale.ROOT);
        for (String domain : domains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    public List<String> domains() {
        return domains;
    }
}
