package com.delta.jobprep.mining.service;

import com.delta.jobprep.mining.model.CandidateItem;
import com.delta.jobprep.mining.model.JobProfile;
import com.delta.jobprep.mining.model.MiningReport;
import com.delta.jobprep.mining.model.PrepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Mine, generate, enhance, refine, store. Without a {@link QuestionGenerator} bean only the
 * mining half runs.
 */
@Service
public class InterviewPrepPipeline {
    private static final Logger log = LoggerFactory.getLogger(InterviewPrepPipeline.class);

    private final KnowledgeMiningService miningService;
    private final ObjectProvider<QuestionGenerator> generatorProvider;
    private final CandidateEnhancementService enhancementService;
    private final QuestionBankService questionBank;

    public InterviewPrepPipeline(
        KnowledgeMiningService miningService,
        ObjectProvider<QuestionGenerator> generatorProvider,
        CandidateEnhancementService enhancementService,
        QuestionBankService questionBank
    ) {
        this.miningService = miningService;
        this.generatorProvider = generatorProvider;
        this.enhancementService = enhancementService;
        this.questionBank = questionBank;
    }

    public PrepResult run(JobProfile profile) {
        MiningReport report = miningService.mine(profile);
        QuestionGenerator generator = generatorProvider.getIfAvailable();
        if (generator == null) {
            log.info("No question generator configured; returning mining report only");
            return new PrepResult(report, List.of());
        }

        List<CandidateItem> generated;
        try {
            generated = generator.generate(profile, report.context());
        } catch (Exception e) {
            log.warn("Question generation failed for role='{}': {}", profile.role(), e.getMessage());
            return new PrepResult(report, List.of());
        }
        if (generated == null || generated.isEmpty()) {
            return new PrepResult(report, List.of());
        }

        List<CandidateItem> enhanced = enhancementService.enhanceAll(generated, report.context().text());
        List<CandidateItem> refined = questionBank.refine(enhanced, profile);
        questionBank.store(profile, refined);
        return new PrepResult(report, refined);
    }
}
