package com.delta.jobprep.mining.render;

import java.time.Duration;

public interface RenderedPage extends AutoCloseable {

    void navigate(String url, Duration timeout);

    String title();

    String html();

    @Override
    void close();
}
