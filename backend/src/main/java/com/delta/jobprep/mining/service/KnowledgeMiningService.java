package com.delta.jobprep.mining.service;

import com.delta.jobprep.config.MinerProperties;
import com.delta.jobprep.mining.compress.ContextCompressor;
import com.delta.jobprep.mining.discovery.SearchDiscoveryService;
import com.delta.jobprep.mining.fetch.ContentFetcher;
import com.delta.jobprep.mining.model.CompressionResult;
import com.delta.jobprep.mining.model.ContentItem;
import com.delta.jobprep.mining.model.JobProfile;
import com.delta.jobprep.mining.model.MiningReport;
import com.delta.jobprep.mining.model.ScoredItem;
import com.delta.jobprep.mining.persistence.SearchResultRepository;
import com.delta.jobprep.mining.scoring.RelevanceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
public class KnowledgeMiningService {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeMiningService.class);

    private final SeedUrlPlanner seedUrlPlanner;
    private final SearchDiscoveryService discovery;
    private final ContentFetcher fetcher;
    private final RelevanceScorer scorer;
    private final SearchResultRepository searchResults;
    private final ContextCompressor compressor;
    private final MinerProperties.Scoring scoring;

    public KnowledgeMiningService(
        SeedUrlPlanner seedUrlPlanner,
        SearchDiscoveryService discovery,
        ContentFetcher fetcher,
        RelevanceScorer scorer,
        SearchResultRepository searchResults,
        ContextCompressor compressor,
        MinerProperties properties
    ) {
        this.seedUrlPlanner = seedUrlPlanner;
        this.discovery = discovery;
        this.fetcher = fetcher;
        this.scorer = scorer;
        this.searchResults = searchResults;
        this.compressor = compressor;
        this.scoring = properties.getScoring();
    }

    public MiningReport mine(JobProfile profile) {
        List<String> seeds = seedUrlPlanner.plan(profile, discovery.discover(profile));
        log.info("Mining {} seed urls for role='{}' company='{}'", seeds.size(), profile.role(), profile.company());

        List<ContentItem> fetched = fetcher.fetchAllWithFallback(seeds);
        Set<String> fetchedUrls = new HashSet<>();
        for (ContentItem item : fetched) {
            fetchedUrls.add(item.url());
        }
        List<String> failedUrls = seeds.stream().filter(url -> !fetchedUrls.contains(url)).toList();

        List<ContentItem> retained = rank(fetched, profile);
        int stored = 0;
        for (ContentItem item : retained) {
            try {
                searchResults.insertSearchResult(profile, item);
                stored++;
            } catch (DataAccessException e) {
                log.warn("Unable to store search result {}: {}", item.url(), e.getMessage());
            }
        }

        CompressionResult context = compressor.compress(retained.stream().map(ScoredItem::of).toList());
        log.info(
            "Mining finished: fetched={} failed={} retained={} stored={} contextTokens={}",
            fetched.size(),
            failedUrls.size(),
            retained.size(),
            stored,
            context.estimatedTokens()
        );
        return new MiningReport(profile, seeds.size(), fetched.size(), retained, failedUrls, context);
    }

    /**
     * Scores every item and keeps the best ones above the relevance floor, highest score first.
     */
    List<ContentItem> rank(List<ContentItem> items, JobProfile profile) {
        List<ContentItem> scored = new ArrayList<>();
        for (ContentItem item : items) {
            ContentItem withScore = item.withRelevanceScore(scorer.score(item, profile));
            if (withScore.relevanceScore() > scoring.getMinRelevance()) {
                scored.add(withScore);
            }
        }
        scored.sort(Comparator.comparingDouble(ContentItem::relevanceScore).reversed());
        return scored.size() > scoring.getMaxResults()
            ? List.copyOf(scored.subList(0, scoring.getMaxResults()))
            : List.copyOf(scored);
    }
}
