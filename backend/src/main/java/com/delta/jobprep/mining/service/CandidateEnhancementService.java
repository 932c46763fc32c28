package com.delta.jobprep.mining.service;

import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.model.CandidateItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the enhancer over a batch on the bounded enhancement pool. A failed or slow call keeps the
 * original candidate; output order matches input order.
 */
@Service
public class CandidateEnhancementService {
    private static final Logger log = LoggerFactory.getLogger(CandidateEnhancementService.class);

    private final ObjectProvider<CandidateEnhancer> enhancerProvider;
    private final ExecutorService enhancementExecutor;
    private final long timeoutSeconds;

    public CandidateEnhancementService(
        ObjectProvider<CandidateEnhancer> enhancerProvider,
        @Qualifier("enhancementExecutor") ExecutorService enhancementExecutor,
        MinerProperties properties
    ) {
        this.enhancerProvider = enhancerProvider;
        this.enhancementExecutor = enhancementExecutor;
        this.timeoutSeconds = properties.getEnhancement().getTimeoutSeconds();
    }

    public List<CandidateItem> enhanceAll(List<CandidateItem> candidates, String context) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        CandidateEnhancer enhancer = enhancerProvider.getIfAvailable();
        if (enhancer == null) {
            return List.copyOf(candidates);
        }

        List<Future<CandidateItem>> futures = new ArrayList<>(candidates.size());
        for (CandidateItem candidate : candidates) {
            futures.add(enhancementExecutor.submit(() -> enhancer.enhance(candidate, context)));
        }

        List<CandidateItem> results = new ArrayList<>(candidates.size());
        int substituted = 0;
        for (int i = 0; i < candidates.size(); i++) {
            CandidateItem original = candidates.get(i);
            CandidateItem enhanced = await(futures.get(i), original);
            if (enhanced == null) {
                substituted++;
                enhanced = original;
            }
            results.add(enhanced);
        }
        if (substituted > 0) {
            log.warn("Kept {} of {} candidates unenhanced", substituted, candidates.size());
        }
        return results;
    }

    // null when no enhanced item is available
    private CandidateItem await(Future<CandidateItem> future, CandidateItem original) {
        if (Thread.currentThread().isInterrupted()) {
            future.cancel(true);
            return null;
        }
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Enhancement timed out after {}s for '{}'", timeoutSeconds, abbreviate(original.text()));
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Enhancement failed for '{}': {}", abbreviate(original.text()), cause.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return null;
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 60 ? text : text.substring(0, 57) + "...";
    }
}
