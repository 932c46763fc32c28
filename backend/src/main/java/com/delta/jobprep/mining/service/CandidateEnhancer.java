package com.delta.jobprep.mining.service;

import com.delta.jobprep.mining.model.CandidateItem;

/**
 * External generation step that improves a single candidate, typically by writing a fuller answer.
 */
public interface CandidateEnhancer {
    CandidateItem enhance(CandidateItem candidate, String context) throws Exception;
}
