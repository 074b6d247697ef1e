package dev.mars.mqclient.api;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

import dev.mars.mqclient.api.error.MqClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives errors that are not returned to a caller: connection outages that were
 * recovered, poison messages that were dropped, late acknowledgments.
 *
 * <p>Implementations must not throw.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
@FunctionalInterface
public interface ErrorSink {

    void accept(MqClientException error);

    /**
     * Sink that writes every error to the {@code dev.mars.mqclient.errors} logger.
     */
    static ErrorSink logging() {
        Logger logger = LoggerFactory.getLogger("dev.mars.mqclient.errors");
        return error -> logger.warn("{}: {}", error.getClass().getSimpleName(), error.getMessage(), error.getCause());
    }

    /**
     * Sends every error to this sink and then to {@code next}; a failure in one does
     * not prevent the other from being called.
     */
    default ErrorSink andThen(ErrorSink next) {
        return error -> {
            try {
                accept(error);
            } finally {
                next.accept(error);
            }
        };
    }
}
