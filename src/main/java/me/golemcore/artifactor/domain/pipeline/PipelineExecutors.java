package me.golemcore.artifactor.domain.pipeline;

import java.util.concurrent.ExecutorService;

/**
 * Thread pools used by a run: one for whole runs, one for parallel stages and
 * per-chunk work, one for CPU-bound source parsing.
 */
public record PipelineExecutors(ExecutorService run, ExecutorService stage, ExecutorService parse) {
}
