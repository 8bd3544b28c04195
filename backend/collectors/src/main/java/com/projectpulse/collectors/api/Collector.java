package com.projectpulse.collectors.api;

import com.projectpulse.core.model.RawActivity;
import com.projectpulse.core.model.Source;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A source adapter. One call fetches one finite batch; no paging state is kept between calls.
 */
public interface Collector {
    String name();

    Source source();

    CompletableFuture<List<RawActivity>> collect(CollectorContext ctx, Instant since);
}
