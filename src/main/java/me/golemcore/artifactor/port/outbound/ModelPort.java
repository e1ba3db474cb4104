package me.golemcore.artifactor.port.outbound;

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

import me.golemcore.artifactor.domain.model.ModelMessage;
import me.golemcore.artifactor.domain.model.ModelReply;
import me.golemcore.artifactor.domain.model.ResponseMode;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for calling a language model by name. Implementations must not retry on
 * their own; retries and fallback are owned by the caller. Failures should
 * carry a status code where the provider reports one.
 */
public interface ModelPort {

    CompletableFuture<ModelReply> call(String modelName, List<ModelMessage> messages, Duration timeout,
            ResponseMode mode);
}
