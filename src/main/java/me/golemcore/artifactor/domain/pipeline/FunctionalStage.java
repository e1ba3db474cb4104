package me.golemcore.artifactor.domain.pipeline;

import lombok.Builder;
import me.golemcore.artifactor.domain.model.TraceCategory;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Stage assembled from functions.
 */
@Builder
public class FunctionalStage<T> implements PipelineStage<T> {

    private final String name;
    private final Function<PipelineContext, T> body;
    private final Supplier<T> fallback;
    @Builder.Default
    private final TraceCategory category = TraceCategory.PIPELINE;
    private final Function<PipelineContext, String> description;
    private final Function<T, String> summary;

    @Override
    public String getName() {
        return name;
    }

    @Override
    public T execute(PipelineContext context) {
        return body.apply(context);
    }

    @Override
    public T defaultResult() {
        return fallback != null ? fallback.get() : null;
    }

    @Override
    public TraceCategory getCategory() {
        return category;
    }

    @Override
    public String describe(PipelineContext context) {
        return description != null ? description.apply(context) : "";
    }

    @Override
    public String summarize(T result) {
        return summary != null && result != null ? summary.apply(result) : "";
    }
}
