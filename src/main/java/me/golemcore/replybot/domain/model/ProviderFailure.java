package me.golemcore.replybot.domain.model;

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

/**
 * Classification of a failed generation attempt.
 */
public enum ProviderFailure {

    /** Credentials or endpoint missing; no attempt, no tracker effect. */
    NOT_CONFIGURED(false),
    /** Skipped without an attempt because the circuit is open. */
    CIRCUIT_OPEN(false),
    TIMEOUT(true),
    HTTP_ERROR(true),
    MALFORMED_RESPONSE(true),
    NETWORK_ERROR(true);

    private final boolean countsAsError;

    ProviderFailure(boolean countsAsError) {
        this.countsAsError = countsAsError;
    }

    /**
     * Whether this failure is recorded on the provider's error tracker.
     */
    public boolean countsAsError() {
        return countsAsError;
    }
}
