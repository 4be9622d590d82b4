package uz.sonic.continuum.provider;

import org.springframework.stereotype.Component;
import uz.sonic.continuum.model.GitProvider;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ProviderAdapters {

    private final Map<GitProvider, ProviderAdapter<?>> adapters = new EnumMap<>(GitProvider.class);

    public ProviderAdapters(List<ProviderAdapter<?>> adapters) {
        adapters.forEach(adapter -> this.adapters.put(adapter.provider(), adapter));
        for (GitProvider provider : GitProvider.values()) {
            if (!this.adapters.containsKey(provider)) {
                throw new IllegalStateException("No adapter registered for " + provider.id());
            }
        }
    }

    public ProviderAdapter<?> forProvider(GitProvider provider) {
        return adapters.get(provider);
    }
}
