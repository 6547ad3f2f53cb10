package me.golemcore.replybot.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.replybot.domain.model.ReplyRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates static reply rules against a message.
 *
 * <p>
 * Rules run in descending priority (missing priority counts as 0, ties keep
 * their configured order) and the first match wins. Regex rules are searched
 * in the raw text; literal rules are substring matches, lower-cased on both
 * sides unless the rule is case-sensitive. A rule with an invalid regex never
 * matches; it is reported once per pattern until the cache is cleared.
 */
@Component
@Slf4j
public class ReplyRuleEvaluator {

    private static final Comparator<ReplyRule> BY_PRIORITY_DESC = Comparator
            .comparingInt(ReplyRule::effectivePriority).reversed();

    private final Map<String, Optional<Pattern>> compiledPatterns = new ConcurrentHashMap<>();

    public Optional<ReplyRule> evaluate(String messageText, List<ReplyRule> rules) {
        if (rules == null || rules.isEmpty() || messageText == null) {
            return Optional.empty();
        }
        List<ReplyRule> sorted = new ArrayList<>(rules);
        sorted.sort(BY_PRIORITY_DESC);

        for (ReplyRule rule : sorted) {
            if (rule != null && matches(rule, messageText)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public boolean matches(ReplyRule rule, String messageText) {
        String match = rule.getMatch();
        if (match == null || messageText == null) {
            return false;
        }
        if (rule.isRegex()) {
            return compile(match)
                    .map(pattern -> pattern.matcher(messageText).find())
                    .orElse(false);
        }
        if (rule.isCaseSensitive()) {
            return messageText.contains(match);
        }
        return messageText.toLowerCase(Locale.ROOT).contains(match.toLowerCase(Locale.ROOT));
    }

    /**
     * Drops compiled patterns; called when the rule set is replaced.
     */
    public void clearCache() {
        compiledPatterns.clear();
    }

    int cachedPatternCount() {
        return compiledPatterns.size();
    }

    private Optional<Pattern> compile(String regex) {
        return compiledPatterns.computeIfAbsent(regex, key -> {
            try {
                return Optional.of(Pattern.compile(key));
            } catch (PatternSyntaxException e) {
                log.warn("[RuleEvaluator] Invalid rule pattern '{}': {}", key, e.getDescription());
                return Optional.empty();
            }
        });
    }
}
