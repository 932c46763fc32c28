package com.delta.jobprep.mining.fetch;

import com.delta.jobprep.config.MinerConfig;
import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.cache.ContentItemCodec;
import com.delta.jobprep.mining.cache.InMemoryContentCache;
import com.delta.jobprep.mining.extract.ContentNormalizer;
import com.delta.jobprep.mining.http.PoliteHttpClient;
import com.delta.jobprep.mining.model.ContentItem;
import com.delta.jobprep.mining.model.FetchStrategy;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContentFetcherTest {
    private static final String PAGE = """
        <html>
          <head><title>Java Interview Questions</title><script>var x = 1;</script></head>
          <body>
            <nav>Home | About</nav>
            <article>What is the JVM?   Explain   garbage collection.</article>
            <footer>Copyright</footer>
          </body>
        </html>
        """;

    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService fetchExecutor;
    private MinerProperties properties;
    private InMemoryContentCache cache;
    private ContentItemCodec codec;
    private RenderedPageFetcher renderedPageFetcher;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        httpExecutor = Executors.newFixedThreadPool(2);
        fetchExecutor = Executors.newFixedThreadPool(3);
        properties = new MinerProperties();
        properties.getFetch().setRequestTimeoutSeconds(5);
        properties.getFetch().setRequestsPerSecond(50);
        properties.getFetch().setRenderedFallback(false);
        cache = new InMemoryContentCache();
        codec = new ContentItemCodec(new MinerConfig().objectMapper());
        renderedPageFetcher = Mockito.mock(RenderedPageFetcher.class);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        httpExecutor.shutdownNow();
        fetchExecutor.shutdownNow();
    }

    @Test
    void notFoundIsAbsentWithSingleRequestAndNothingCached() {
        server.enqueue(new MockResponse().setResponseCode(404));
        String url = server.url("/missing").toString();

        Optional<ContentItem> item = newFetcher().fetch(url, FetchStrategy.LIGHTWEIGHT);

        assertThat(item).isEmpty();
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(cache.contains(url)).isFalse();
    }

    @Test
    void successfulFetchIsNormalizedAndCached() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(PAGE));
        String url = server.url("/java").toString();

        ContentItem item = newFetcher().fetch(url, FetchStrategy.LIGHTWEIGHT).orElseThrow();

        assertThat(item.url()).isEqualTo(url);
        assertThat(item.title()).isEqualTo("Java Interview Questions");
        assertThat(item.body()).isEqualTo("What is the JVM? Explain garbage collection.");
        assertThat(item.relevanceScore()).isZero();
        assertThat(cache.contains(url)).isTrue();
    }

    @Test
    void cacheHitReturnsIdenticalItemWithoutNetwork() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(PAGE));
        String url = server.url("/java").toString();
        ContentFetcher fetcher = newFetcher();

        ContentItem first = fetcher.fetch(url, FetchStrategy.LIGHTWEIGHT).orElseThrow();
        ContentItem second = fetcher.fetch(url, FetchStrategy.LIGHTWEIGHT).orElseThrow();
        ContentItem rendered = fetcher.fetch(url, FetchStrategy.RENDERED).orElseThrow();

        assertThat(second).isEqualTo(first);
        assertThat(rendered).isEqualTo(first);
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(cache.putCount()).isEqualTo(1);
        verify(renderedPageFetcher, never()).fetch(anyString());
    }

    @Test
    void corruptCacheEntryFallsThroughToLiveFetch() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(PAGE));
        String url = server.url("/java").toString();
        cache.put(url, "{broken".getBytes(StandardCharsets.UTF_8));

        Optional<ContentItem> item = newFetcher().fetch(url, FetchStrategy.LIGHTWEIGHT);

        assertThat(item).isPresent();
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(codec.decode(cache.get(url).orElseThrow())).contains(item.get());
    }

    @Test
    void renderedStrategyDelegatesToBrowserFetcher() {
        String url = "https://app.example.com/questions";
        ContentItem renderedItem = new ContentItem(url, "Rendered", "body", "app.example.com", 0.0, Instant.now());
        when(renderedPageFetcher.fetch(url)).thenReturn(Optional.of(renderedItem));

        Optional<ContentItem> item = newFetcher().fetch(url, FetchStrategy.RENDERED);

        assertThat(item).contains(renderedItem);
        assertThat(server.getRequestCount()).isZero();
        assertThat(cache.contains(url)).isTrue();
    }

    @Test
    void fallbackUsesRenderedFetchOnlyWhenEnabled() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));
        String url = server.url("/spa").toString();
        ContentItem renderedItem = new ContentItem(url, "SPA", "rendered body", "spa", 0.0, Instant.now());
        when(renderedPageFetcher.fetch(url)).thenReturn(Optional.of(renderedItem));

        assertThat(newFetcher().fetchWithFallback(url)).isEmpty();
        verify(renderedPageFetcher, never()).fetch(url);

        properties.getFetch().setRenderedFallback(true);
        assertThat(newFetcher().fetchWithFallback(url)).contains(renderedItem);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void fetchAllKeepsInputOrderAndFetchesDuplicatesOnce() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath();
                if ("/gone".equals(path)) {
                    return new MockResponse().setResponseCode(410);
                }
                return new MockResponse().setResponseCode(200)
                    .setBody("<html><head><title>" + path + "</title></head><body>page " + path + "</body></html>");
            }
        });
        String b = server.url("/b").toString();
        String a = server.url("/a").toString();
        String gone = server.url("/gone").toString();

        List<ContentItem> items = newFetcher().fetchAll(List.of(b, gone, a, b), FetchStrategy.LIGHTWEIGHT);

        assertThat(items).extracting(ContentItem::url).containsExactly(b, a);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    private ContentFetcher newFetcher() {
        PoliteHttpClient httpClient = new PoliteHttpClient(
            properties,
            httpExecutor,
            MinerConfig.buildFetchRateLimiter(properties.getFetch())
        );
        return new ContentFetcher(
            cache,
            codec,
            httpClient,
            renderedPageFetcher,
            new ContentNormalizer(properties),
            fetchExecutor,
            properties
        );
    }
}
