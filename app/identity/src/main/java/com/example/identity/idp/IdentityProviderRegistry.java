package com.example.identity.idp;

import com.example.identity.api.response.IdpDescriptor;
import com.example.identity.config.IdentityProperties;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps provider names to providers.
 *
 * <p>Built once from every {@link IdentityProvider} bean and immutable afterwards, so lookups need
 * no synchronization. When {@code identity.enabled-idps} is set only the listed providers are
 * registered.
 */
@Component
public class IdentityProviderRegistry {

  private static final Logger logger = LoggerFactory.getLogger(IdentityProviderRegistry.class);

  private final Map<String, IdentityProvider> providers;

  public IdentityProviderRegistry(List<IdentityProvider> providers, IdentityProperties properties) {
    final Map<String, IdentityProvider> byName = new LinkedHashMap<>();
    for (IdentityProvider provider : providers) {
      final String name = provider.name();
      if (name == null || name.isBlank()) {
        throw new IllegalStateException(
            "identity provider without name: " + provider.getClass().getName());
      }
      if (byName.containsKey(name)) {
        throw new IllegalStateException("duplicate identity provider: " + name);
      }
      byName.put(name, provider);
    }

    final List<String> enabled = properties.enabledIdps();
    if (!enabled.isEmpty()) {
      final Set<String> wanted = new HashSet<>(enabled);
      for (String name : wanted) {
        if (!byName.containsKey(name)) {
          throw new IllegalStateException("enabled identity provider is not available: " + name);
        }
      }
      byName.keySet().retainAll(wanted);
    }
    this.providers = Map.copyOf(byName);
    logger.info("registered identity providers {}", this.providers.keySet());
  }

  public Optional<IdentityProvider> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(providers.get(name));
  }

  public IdentityProvider get(String name) {
    return find(name).orElseThrow(() -> new UnknownIdentityProviderException(name));
  }

  public List<IdpDescriptor> descriptors() {
    return providers.values().stream()
        .map(p -> new IdpDescriptor(p.name(), p.description(), p.interactive()))
        .sorted(Comparator.comparing(IdpDescriptor::name))
        .toList();
  }
}
