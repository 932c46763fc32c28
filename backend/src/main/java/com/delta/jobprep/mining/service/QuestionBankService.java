package com.delta.jobprep.mining.service;

import com.delta.jobprep.mining.dedupe.CandidateDeduplicator;
import com.delta.jobprep.mining.model.CandidateItem;
import com.delta.jobprep.mining.model.JobProfile;
import com.delta.jobprep.mining.persistence.QuestionRepository;
import com.delta.jobprep.mining.scoring.RelevanceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class QuestionBankService {
    private static final Logger log = LoggerFactory.getLogger(QuestionBankService.class);

    private final CandidateDeduplicator deduplicator;
    private final RelevanceScorer scorer;
    private final QuestionRepository questions;

    public QuestionBankService(CandidateDeduplicator deduplicator, RelevanceScorer scorer, QuestionRepository questions) {
        this.deduplicator = deduplicator;
        this.scorer = scorer;
        this.questions = questions;
    }

    /**
     * Deduplicates, scores against the profile and sorts by score (stable on ties).
     */
    public List<CandidateItem> refine(List<CandidateItem> candidates, JobProfile profile) {
        List<CandidateItem> unique = deduplicator.deduplicate(candidates);
        List<CandidateItem> scored = new ArrayList<>(unique.size());
        for (CandidateItem candidate : unique) {
            scored.add(candidate.withRelevanceScore(scorer.score(candidate, profile)));
        }
        scored.sort(Comparator.comparingDouble(CandidateItem::relevanceScore).reversed());
        return List.copyOf(scored);
    }

    public int store(JobProfile profile, List<CandidateItem> candidates) {
        int stored = 0;
        for (CandidateItem candidate : candidates) {
            try {
                questions.insertQuestion(profile, candidate);
                stored++;
            } catch (DataAccessException e) {
                log.warn("Unable to store question '{}': {}", candidate.text(), e.getMessage());
            }
        }
        log.info("Stored {} of {} questions for role='{}'", stored, candidates.size(), profile.role());
        return stored;
    }
}
