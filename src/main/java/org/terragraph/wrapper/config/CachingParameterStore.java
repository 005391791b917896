package org.terragraph.wrapper.config;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

/**
 * Caches lookups of a delegate {@link ParameterStore} so each path is fetched at most once per process,
 * including negative results.
 */
public class CachingParameterStore implements ParameterStore {

    private static final Logger log = LoggerFactory.getLogger(CachingParameterStore.class);

    private final LoadingCache<String, Optional<String>> cache;

    public CachingParameterStore(ParameterStore delegate, long maximumSize) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .build(path -> {
                log.debug("Fetching parameter {}", path);
                return delegate.get(path);
            });
    }

    @Override
    public Optional<String> get(String path) {
        return cache.get(path);
    }
}
