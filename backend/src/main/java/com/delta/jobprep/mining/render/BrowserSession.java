package com.delta.jobprep.mining.render;

/**
 * Long-lived browsing context shared by all rendered fetches. Each {@link #openPage()} call
 * yields an independent page that the caller must close.
 */
public interface BrowserSession {

    RenderedPage openPage();
}
