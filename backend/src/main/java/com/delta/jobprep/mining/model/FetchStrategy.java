package com.delta.jobprep.mining.model;

public enum FetchStrategy {
    /** Direct HTTP request through the shared connection limits and rate limiter. */
    LIGHTWEIGHT,
    /** Page load in the shared browser session, for script-driven pages. */
    RENDERED
}
