package com.delta.jobprep.mining.fetch;

import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.cache.ContentCache;
import com.delta.jobprep.mining.cache.ContentItemCodec;
import com.delta.jobprep.mining.extract.ContentNormalizer;
import com.delta.jobprep.mining.http.PoliteHttpClient;
import com.delta.jobprep.mining.model.ContentItem;
import com.delta.jobprep.mining.model.FetchStrategy;
import com.delta.jobprep.mining.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Cache-first page fetcher. Every failure (bad status, timeout, parse error, exhausted retries)
 * ends as {@link Optional#empty()} and is logged; nothing is thrown to the caller.
 */
@Service
public class ContentFetcher {
    private static final Logger log = LoggerFactory.getLogger(ContentFetcher.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";

    private final ContentCache cache;
    private final ContentItemCodec codec;
    private final PoliteHttpClient httpClient;
    private final RenderedPageFetcher renderedPageFetcher;
    private final ContentNormalizer normalizer;
    private final ExecutorService fetchExecutor;
    private final MinerProperties properties;

    public ContentFetcher(
        ContentCache cache,
        ContentItemCodec codec,
        PoliteHttpClient httpClient,
        RenderedPageFetcher renderedPageFetcher,
        ContentNormalizer normalizer,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
        MinerProperties properties
    ) {
        this.cache = cache;
        this.codec = codec;
        this.httpClient = httpClient;
        this.renderedPageFetcher = renderedPageFetcher;
        this.normalizer = normalizer;
        this.fetchExecutor = fetchExecutor;
        this.properties = properties;
    }

    public Optional<ContentItem> fetch(String url, FetchStrategy strategy) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        Optional<ContentItem> cached = lookup(url);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", url);
            return cached;
        }
        Optional<ContentItem> fetched = strategy == FetchStrategy.RENDERED
            ? fetchRendered(url)
            : fetchLightweight(url);
        fetched.ifPresent(item -> store(url, item));
        return fetched;
    }

    /**
     * Lightweight first, then (when enabled) a rendered fetch for pages the plain request could not produce.
     */
    public Optional<ContentItem> fetchWithFallback(String url) {
        Optional<ContentItem> item = fetch(url, FetchStrategy.LIGHTWEIGHT);
        if (item.isPresent() || !properties.getFetch().isRenderedFallback()) {
            return item;
        }
        return fetch(url, FetchStrategy.RENDERED);
    }

    public List<ContentItem> fetchAll(List<String> urls, FetchStrategy strategy) {
        return fanOut(urls, url -> fetch(url, strategy));
    }

    public List<ContentItem> fetchAllWithFallback(List<String> urls) {
        return fanOut(urls, this::fetchWithFallback);
    }

    private List<ContentItem> fanOut(List<String> urls, Function<String, Optional<ContentItem>> fetchOne) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }
        Map<String, CompletableFuture<Optional<ContentItem>>> futures = new LinkedHashMap<>();
        for (String url : new LinkedHashSet<>(urls)) {
            if (url == null || url.isBlank()) {
                continue;
            }
            futures.put(url, CompletableFuture.supplyAsync(() -> fetchOne.apply(url), fetchExecutor));
        }
        List<ContentItem> items = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<Optional<ContentItem>>> entry : futures.entrySet()) {
            try {
                entry.getValue().join().ifPresent(items::add);
            } catch (RuntimeException e) {
                log.warn("Fetch task failed for {}: {}", entry.getKey(), e.getMessage());
            }
        }
        return items;
    }

    private Optional<ContentItem> fetchLightweight(String url) {
        HttpFetchResult result = httpClient.get(url, HTML_ACCEPT);
        if (!result.isSuccessful()) {
            log.warn("Lightweight fetch failed for {}: {}", url, result.failureReason());
            return Optional.empty();
        }
        try {
            return Optional.of(normalizer.normalize(url, result.body()));
        } catch (RuntimeException e) {
            log.warn("Unable to parse content from {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ContentItem> fetchRendered(String url) {
        try {
            return renderedPageFetcher.fetch(url);
        } catch (RuntimeException e) {
            log.warn("Rendered fetch failed for {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ContentItem> lookup(String url) {
        try {
            return cache.get(url).flatMap(codec::decode);
        } catch (RuntimeException e) {
            log.warn("Cache lookup failed for {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String url, ContentItem item) {
        try {
            cache.put(url, codec.encode(item));
        } catch (RuntimeException e) {
            log.warn("Unable to cache content for {}: {}", url, e.getMessage());
        }
    }
}
