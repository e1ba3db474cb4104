package me.golemcore.artifactor.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.artifactor.domain.ArtifactorConstants;

/**
 * Transient progress event emitted while a stage runs.
 *
 * @param name
 *            stable stage identifier
 * @param status
 *            running, done or error
 * @param message
 *            human readable note
 * @param durationMs
 *            elapsed time, zero for running events
 * @param completed
 *            processed units, chunk-oriented stages only
 * @param total
 *            total units, chunk-oriented stages only
 * @param percent
 *            completion percentage rounded to one decimal
 */
public record StageEvent(
        String name,
        StageProgress status,
        String message,
        double durationMs,
        Integer completed,
        Integer total,
        Double percent
) {

    public static StageEvent running(String name, String message) {
        return new StageEvent(name, StageProgress.RUNNING, message, 0.0, null, null, null);
    }

    public static StageEvent done(String name, String message, double durationMs) {
        return new StageEvent(name, StageProgress.DONE, message, durationMs, null, null, null);
    }

    public static StageEvent error(String name, String message, double durationMs) {
        return new StageEvent(name, StageProgress.ERROR, message, durationMs, null, null, null);
    }

    public static StageEvent progress(String name, String message, int completed, int total) {
        double percent = total > 0 ? Math.round(completed * 1000.0 / total) / 10.0 : 0.0;
        return new StageEvent(name, StageProgress.RUNNING, message, 0.0, completed, total, percent);
    }

    public boolean hasProgress() {
        return completed != null && total != null;
    }

    public String label() {
        return ArtifactorConstants.stageLabel(name);
    }
}
