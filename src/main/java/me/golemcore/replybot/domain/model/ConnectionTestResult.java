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
 * Outcome of a provider connection probe.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionTestResult(boolean success, String modelName, String error) {

    public static ConnectionTestResult ok(String modelName) {
        return new ConnectionTestResult(true, modelName, null);
    }

    public static ConnectionTestResult failed(String error) {
        return new ConnectionTestResult(false, null, error);
    }
}
