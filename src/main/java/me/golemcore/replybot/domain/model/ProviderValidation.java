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

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of checking that a provider's configuration is complete.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderValidation(boolean valid, String error) {

    private static final ProviderValidation VALID = new ProviderValidation(true, null);

    public static ProviderValidation ok() {
        return VALID;
    }

    public static ProviderValidation invalid(String error) {
        return new ProviderValidation(false, error);
    }
}
