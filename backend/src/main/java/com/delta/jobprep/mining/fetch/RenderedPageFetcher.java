package com.delta.jobprep.mining.fetch;

import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.extract.ContentNormalizer;
import com.delta.jobprep.mining.model.ContentItem;
import com.delta.jobprep.mining.render.BrowserSession;
import com.delta.jobprep.mining.render.RenderedPage;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

@Component
public class RenderedPageFetcher {
    private final BrowserSession browserSession;
    private final ContentNormalizer normalizer;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Duration navigationTimeout;
    private final Duration settleDelay;

    @Autowired
    public RenderedPageFetcher(MinerProperties properties, BrowserSession browserSession, ContentNormalizer normalizer) {
        this(properties, browserSession, normalizer, Sleeper.SYSTEM);
    }

    public RenderedPageFetcher(
        MinerProperties properties,
        BrowserSession browserSession,
        ContentNormalizer normalizer,
        Sleeper sleeper
    ) {
        MinerProperties.Rendered rendered = properties.getFetch().getRendered();
        this.browserSession = browserSession;
        this.normalizer = normalizer;
        this.sleeper = sleeper;
        this.retryPolicy = RetryPolicy.ofMillis(rendered.getRetryDelaysMs(), sleeper);
        this.navigationTimeout = Duration.ofSeconds(rendered.getNavigationTimeoutSeconds());
        this.settleDelay = Duration.ofMillis(rendered.getSettleDelayMs());
    }

    public Optional<ContentItem> fetch(String url) {
        return retryPolicy.execute(url, attempt -> Optional.of(renderOnce(url)));
    }

    public int maxAttempts() {
        return retryPolicy.maxAttempts();
    }

    private ContentItem renderOnce(String url) throws InterruptedException {
        try (RenderedPage page = browserSession.openPage()) {
            page.navigate(url, navigationTimeout);
            if (!settleDelay.isZero()) {
                sleeper.sleep(settleDelay);
            }
            return normalizer.normalize(url, page.html(), page.title());
        }
    }
}
