package me.golemcore.artifactor.domain.resilience;

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

import me.golemcore.artifactor.domain.exception.ModelCallException;
import me.golemcore.artifactor.domain.model.ErrorClass;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies outbound call failures into {@link ErrorClass} values.
 *
 * <p>
 * Structured signals win over text: a status code anywhere in the cause chain
 * decides first, then known timeout and rate-limit exception types, and only
 * then message substrings.
 */
public final class ErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final int TOO_MANY_REQUESTS = 429;

    private ErrorClassifier() {
    }

    public static ErrorClass classify(Throwable throwable) {
        if (throwable == null) {
            return ErrorClass.UNKNOWN;
        }
        List<Throwable> chain = causeChain(throwable);

        for (Throwable current : chain) {
            OptionalInt statusCode = statusCode(current);
            if (statusCode.isPresent()) {
                return classifyStatus(statusCode.getAsInt());
            }
            if (isTimeoutType(current)) {
                return ErrorClass.TIMEOUT;
            }
            if (CLASS_RATE_LIMIT_EXCEPTION.equals(current.getClass().getName())) {
                return ErrorClass.TRANSIENT;
            }
        }

        for (Throwable current : chain) {
            ErrorClass byMessage = classifyMessage(current.getMessage());
            if (byMessage != ErrorClass.UNKNOWN) {
                return byMessage;
            }
        }
        return ErrorClass.UNKNOWN;
    }

    public static boolean isRetryable(Throwable throwable) {
        return classify(throwable).isRetryable();
    }

    /**
     * Check whether a failure is a provider rate limit. Rate limits are retried
     * with backoff and are not counted against a model's circuit breaker.
     */
    public static boolean isRateLimit(Throwable throwable) {
        if (throwable == null) {
            return false;
        }
        List<Throwable> chain = causeChain(throwable);
        for (Throwable current : chain) {
            OptionalInt statusCode = statusCode(current);
            if (statusCode.isPresent()) {
                return statusCode.getAsInt() == TOO_MANY_REQUESTS;
            }
            if (CLASS_RATE_LIMIT_EXCEPTION.equals(current.getClass().getName())) {
                return true;
            }
        }
        for (Throwable current : chain) {
            String message = current.getMessage();
            if (message != null) {
                String normalized = message.toLowerCase(Locale.ROOT);
                if (containsAny(normalized, "429", "rate limit", "rate_limit")) {
                    return true;
                }
            }
        }
        return false;
    }

    static ErrorClass classifyStatus(int statusCode) {
        if (statusCode == TOO_MANY_REQUESTS) {
            return ErrorClass.TRANSIENT;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return ErrorClass.CLIENT;
        }
        if (statusCode >= 500) {
            return ErrorClass.SERVER;
        }
        return ErrorClass.UNKNOWN;
    }

    static ErrorClass classifyMessage(String message) {
        if (message == null || message.isBlank()) {
            return ErrorClass.UNKNOWN;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (containsAny(normalized, "timeout", "timed out")) {
            return ErrorClass.TIMEOUT;
        }
        if (containsAny(normalized, "429", "rate limit", "rate_limit")) {
            return ErrorClass.TRANSIENT;
        }
        if (containsAny(normalized, "500", "502", "503", "504")) {
            return ErrorClass.SERVER;
        }
        if (containsAny(normalized, "econnrefused", "connection")) {
            return ErrorClass.TRANSIENT;
        }
        if (containsAny(normalized, "400", "401", "403", "404")) {
            return ErrorClass.CLIENT;
        }
        return ErrorClass.UNKNOWN;
    }

    private static List<Throwable> causeChain(Throwable throwable) {
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (!(current instanceof CompletionException) && !(current instanceof ExecutionException)) {
                chain.add(current);
            }
            current = current.getCause();
        }
        if (chain.isEmpty()) {
            chain.add(throwable);
        }
        return chain;
    }

    private static boolean isTimeoutType(Throwable throwable) {
        return throwable instanceof TimeoutException
                || throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || CLASS_TIMEOUT_EXCEPTION.equals(throwable.getClass().getName());
    }

    private static OptionalInt statusCode(Throwable throwable) {
        if (throwable instanceof ModelCallException modelCallException) {
            return modelCallException.getStatusCode();
        }
        if (!throwable.getClass().getName().startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return OptionalInt.empty();
        }
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer code) {
                return OptionalInt.of(code);
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return OptionalInt.empty();
        }
        return OptionalInt.empty();
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
