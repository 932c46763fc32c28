package com.delta.jobprep.mining.scoring;

/**
 * Anything the relevance scorer can rank.
 */
public interface Scorable {
    String title();

    String body();

    String source();
}
