package com.delta.jobprep.mining.service;

import com.delta.jobprep.mining.model.CandidateItem;
import com.delta.jobprep.mining.model.CompressionResult;
import com.delta.jobprep.mining.model.Difficulty;
import com.delta.jobprep.mining.model.JobProfile;
import com.delta.jobprep.mining.model.MiningReport;
import com.delta.jobprep.mining.model.PrepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InterviewPrepPipelineTest {
    private static final JobProfile PROFILE = new JobProfile("Data Engineer", "Acme", List.of("SQL"), 3);
    private static final CompressionResult CONTEXT = new CompressionResult(
        "Source 1: window functions",
        1,
        1,
        6,
        0.8,
        Set.of("GitHub")
    );

    @Mock
    private KnowledgeMiningService miningService;

    @Mock
    private CandidateEnhancementService enhancementService;

    @Mock
    private QuestionBankService questionBank;

    private MiningReport report;

    @BeforeEach
    void setUp() {
        report = new MiningReport(PROFILE, 1, 1, List.of(), List.of(), CONTEXT);
        when(miningService.mine(PROFILE)).thenReturn(report);
    }

    @Test
    void generatedQuestionsAreEnhancedRefinedAndStored() {
        CandidateItem generated = new CandidateItem("What is a window function?", "", "Technical", Difficulty.MEDIUM, Set.of("SQL"));
        CandidateItem enhanced = generated.withAnswer("Computes over a frame of rows.");
        CandidateItem refined = enhanced.withRelevanceScore(0.7);
        when(enhancementService.enhanceAll(List.of(generated), CONTEXT.text())).thenReturn(List.of(enhanced));
        when(questionBank.refine(List.of(enhanced), PROFILE)).thenReturn(List.of(refined));

        PrepResult result = newPipeline((profile, context) -> List.of(generated)).run(PROFILE);

        assertThat(result.report()).isSameAs(report);
        assertThat(result.questions()).containsExactly(refined);
        verify(questionBank).store(PROFILE, List.of(refined));
    }

    @Test
    void withoutGeneratorOnlyMiningRuns() {
        PrepResult result = newPipeline(null).run(PROFILE);

        assertThat(result.questions()).isEmpty();
        verify(enhancementService, never()).enhanceAll(any(), any());
        verify(questionBank, never()).store(any(), any());
    }

    @Test
    void generatorFailureStillReturnsReport() {
        PrepResult result = newPipeline((profile, context) -> {
            throw new IllegalStateException("quota exceeded");
        }).run(PROFILE);

        assertThat(result.report()).isSameAs(report);
        assertThat(result.questions()).isEmpty();
        verify(questionBank, never()).refine(any(), any());
    }

    private InterviewPrepPipeline newPipeline(QuestionGenerator generator) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        if (generator != null) {
            beanFactory.addBean("questionGenerator", generator);
        }
        return new InterviewPrepPipeline(
            miningService,
            beanFactory.getBeanProvider(QuestionGenerator.class),
            enhancementService,
            questionBank
        );
    }
}
