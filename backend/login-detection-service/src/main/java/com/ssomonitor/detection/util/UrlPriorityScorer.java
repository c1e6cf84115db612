package com.ssomonitor.detection.util;

import com.ssomonitor.detection.dto.LoginPageAnalysisConfig.UrlRegexRule;
import com.ssomonitor.detection.dto.Priority;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Scores URLs against the task's regex rules. The highest priority among matching rules wins,
 * ties keep the earlier rule, and a URL matching nothing scores 0.
 */
@Slf4j
public class UrlPriorityScorer {

    private final List<CompiledRule> rules;

    public UrlPriorityScorer(List<UrlRegexRule> rules) {
        this.rules = new ArrayList<>();
        for (UrlRegexRule rule : rules) {
            if (rule.regex() == null || rule.regex().isEmpty()) {
                continue;
            }
            try {
                this.rules.add(new CompiledRule(rule, Pattern.compile(rule.regex(), Pattern.CASE_INSENSITIVE)));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid login page regex '{}': {}", rule.regex(), e.getDescription());
            }
        }
    }

    public Priority score(String url) {
        Priority best = Priority.NONE;
        for (CompiledRule rule : rules) {
            if (rule.pattern().matcher(url).find() && rule.rule().priority() > best.priority()) {
                best = new Priority(rule.rule().priority(), rule.rule().regex());
            }
        }
        return best;
    }

    private record CompiledRule(UrlRegexRule rule, Pattern pattern) {
    }
}
