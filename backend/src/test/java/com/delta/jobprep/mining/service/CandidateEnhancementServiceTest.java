package com.delta.jobprep.mining.service;

import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.model.CandidateItem;
import com.delta.jobprep.mining.model.Difficulty;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateEnhancementServiceTest {
    private ExecutorService executor;
    private MinerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MinerProperties();
        properties.getEnhancement().setPoolSize(2);
        properties.getEnhancement().setTimeoutSeconds(1);
        executor = Executors.newFixedThreadPool(properties.getEnhancement().getPoolSize());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void enhancedItemsKeepInputOrder() {
        CandidateEnhancer enhancer = (candidate, context) -> {
            if (candidate.text().startsWith("slow")) {
                Thread.sleep(150);
            }
            return candidate.withAnswer("answer for " + candidate.text() + " using " + context);
        };

        List<CandidateItem> result = newService(enhancer).enhanceAll(
            List.of(candidate("slow one"), candidate("fast two"), candidate("fast three")),
            "ctx"
        );

        assertThat(result).extracting(CandidateItem::answer).containsExactly(
            "answer for slow one using ctx",
            "answer for fast two using ctx",
            "answer for fast three using ctx"
        );
    }

    @Test
    void failingCallKeepsOriginalItem() {
        CandidateEnhancer enhancer = (candidate, context) -> {
            if (candidate.text().contains("broken")) {
                throw new IllegalStateException("model refused");
            }
            return candidate.withAnswer("ok");
        };
        CandidateItem broken = candidate("broken item");

        List<CandidateItem> result = newService(enhancer).enhanceAll(List.of(candidate("fine"), broken), "");

        assertThat(result.get(0).answer()).isEqualTo("ok");
        assertThat(result.get(1)).isSameAs(broken);
    }

    @Test
    void slowCallIsReplacedByOriginalAfterTimeout() {
        CandidateEnhancer enhancer = (candidate, context) -> {
            if (candidate.text().contains("stuck")) {
                Thread.sleep(10_000);
            }
            return candidate.withAnswer("done");
        };
        CandidateItem stuck = candidate("stuck item");

        long started = System.nanoTime();
        List<CandidateItem> result = newService(enhancer).enhanceAll(List.of(stuck, candidate("quick")), "");
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertThat(result.get(0)).isSameAs(stuck);
        assertThat(result.get(1).answer()).isEqualTo("done");
        assertThat(elapsedMs).isLessThan(5_000);
    }

    @Test
    void concurrencyIsBoundedByPoolSize() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CandidateEnhancer enhancer = (candidate, context) -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(40);
            running.decrementAndGet();
            return candidate;
        };

        newService(enhancer).enhanceAll(
            List.of(candidate("a"), candidate("b"), candidate("c"), candidate("d"), candidate("e")),
            ""
        );

        assertThat(peak.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void withoutEnhancerInputIsReturnedUnchanged() {
        List<CandidateItem> input = List.of(candidate("a"), candidate("b"));
        CandidateEnhancementService service = new CandidateEnhancementService(
            new StaticListableBeanFactory().getBeanProvider(CandidateEnhancer.class),
            executor,
            properties
        );

        assertThat(service.enhanceAll(input, "ctx")).isEqualTo(input);
        assertThat(service.enhanceAll(List.of(), "ctx")).isEmpty();
    }

    private CandidateEnhancementService newService(CandidateEnhancer enhancer) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("enhancer", enhancer);
        ObjectProvider<CandidateEnhancer> provider = beanFactory.getBeanProvider(CandidateEnhancer.class);
        return new CandidateEnhancementService(provider, executor, properties);
    }

    private static CandidateItem candidate(String text) {
        return new CandidateItem(text, "", "Technical", Difficulty.MEDIUM, Set.of());
    }
}
