package com.di.healthnova.handler;

import com.di.healthnova.exception.UnsupportedFormatException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Registry of provider adapters, keyed by provider name.
 *
 * <p>All {@link ProviderAdapter} beans are discovered through dependency injection and registered by
 * {@link ProviderAdapter#provider()}. Lookup is case-insensitive and trimmed. Two adapters claiming
 * the same provider is a startup error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderAdapterRegistry {

    private final List<ProviderAdapter> adapters;

    private Map<String, ProviderAdapter> adaptersByProvider;

    /**
     * Validates and registers all adapters. Called after injection; tests call it directly.
     */
    @PostConstruct
    void initialize() {
        if (adapters == null || adapters.isEmpty()) {
            log.warn("No ProviderAdapter beans found. Registry will be empty.");
            adaptersByProvider = Collections.emptyMap();
            return;
        }

        adapters.forEach(adapter -> log.info("  - Adapter: {} (provider='{}', format={})",
                adapter.getClass().getSimpleName(), adapter.provider(), adapter.format()));

        Map<String, List<ProviderAdapter>> grouped = adapters.stream()
                .peek(this::validateProvider)
                .collect(Collectors.groupingBy(adapter -> normalize(adapter.provider())));
        validateNoDuplicates(grouped);
        adaptersByProvider = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, entry -> entry.getValue().get(0)));

        log.info("Registered {} provider adapter(s): {}", adaptersByProvider.size(), new TreeSet<>(adaptersByProvider.keySet()));
    }

    /**
     * Returns the adapter for a declared provider.
     *
     * @throws UnsupportedFormatException if no adapter is registered for the provider
     */
    public ProviderAdapter getAdapter(String provider) {
        if (provider == null || provider.isBlank()) {
            throw new UnsupportedFormatException("Provider cannot be null or blank");
        }
        ProviderAdapter adapter = adaptersByProvider.get(normalize(provider));
        if (adapter == null) {
            throw new UnsupportedFormatException(String.format(
                    "Unsupported provider: '%s'. Available providers: %s", provider, new TreeSet<>(adaptersByProvider.keySet())));
        }
        return adapter;
    }

    /**
     * Picks the adapter for a file: the declared provider when given, otherwise the first adapter
     * (in provider-name order) whose {@link ProviderAdapter#canHandle(String)} accepts the file name.
     *
     * @throws UnsupportedFormatException if nothing matches
     */
    public ProviderAdapter resolve(String declaredProvider, String fileName) {
        if (declaredProvider != null && !declaredProvider.isBlank()) {
            return getAdapter(declaredProvider);
        }
        return adaptersByProvider.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(Map.Entry::getValue)
                .filter(adapter -> adapter.canHandle(fileName))
                .findFirst()
                .orElseThrow(() -> new UnsupportedFormatException("No adapter recognizes file '" + fileName + "'"));
    }

    public Set<String> getRegisteredProviders() {
        return Collections.unmodifiableSet(adaptersByProvider.keySet());
    }

    public boolean hasAdapter(String provider) {
        return provider != null && !provider.isBlank() && adaptersByProvider.containsKey(normalize(provider));
    }

    private void validateProvider(ProviderAdapter adapter) {
        String provider = adapter.provider();
        if (provider == null || provider.isBlank()) {
            throw new IllegalStateException(String.format(
                    "Adapter %s returned blank provider(). Provider must be non-null and non-blank.",
                    adapter.getClass().getName()));
        }
        if (adapter.format() == null) {
            throw new IllegalStateException("Adapter " + adapter.getClass().getName() + " declares no RawFormat");
        }
    }

    private void validateNoDuplicates(Map<String, List<ProviderAdapter>> grouped) {
        String detail = grouped.entrySet().stream()
                .filter(entry -> entry.getValue().size() > 1)
                .map(entry -> String.format("'%s' -> [%s]", entry.getKey(), entry.getValue().stream()
                        .map(adapter -> adapter.getClass().getName())
                        .collect(Collectors.joining(", "))))
                .collect(Collectors.joining(" ; "));
        if (!detail.isEmpty()) {
            throw new IllegalStateException("Duplicate ProviderAdapter provider() values detected: " + detail);
        }
    }

    static String normalize(String provider) {
        return provider == null ? null : provider.trim().toLowerCase(Locale.ROOT);
    }
}
