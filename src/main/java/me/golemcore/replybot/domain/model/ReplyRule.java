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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Static pattern rule. {@code match} is a literal substring unless
 * {@code regex} is set, in which case it is a {@link java.util.regex.Pattern}
 * searched in the raw message text (flags may be given inline, e.g.
 * {@code (?i)}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplyRule {

    private String match;
    private String reply;
    private boolean regex;
    /** Higher runs first; null counts as 0. */
    private Integer priority;
    private Boolean caseSensitive;

    public int effectivePriority() {
        return priority != null ? priority : 0;
    }

    public boolean isCaseSensitive() {
        return Boolean.TRUE.equals(caseSensitive);
    }
}
