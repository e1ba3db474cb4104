package me.golemcore.artifactor.domain.exception;

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

import java.util.OptionalInt;

/**
 * Failure of an outbound model call. Carries the provider's HTTP status code
 * when one is known.
 */
public class ModelCallException extends ArtifactorException {

    private final Integer statusCode;

    public ModelCallException(String message) {
        this(message, null, null);
    }

    public ModelCallException(String message, Integer statusCode) {
        this(message, statusCode, null);
    }

    public ModelCallException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
