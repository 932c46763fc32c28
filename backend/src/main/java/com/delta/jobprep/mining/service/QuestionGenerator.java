package com.delta.jobprep.mining.service;

import com.delta.jobprep.mining.model.CandidateItem;
import com.delta.jobprep.mining.model.CompressionResult;
import com.delta.jobprep.mining.model.JobProfile;

import java.util.List;

/**
 * External generation step producing candidate questions from the compressed context.
 */
public interface QuestionGenerator {
    List<CandidateItem> generate(JobProfile profile, CompressionResult context) throws Exception;
}
