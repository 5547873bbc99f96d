package com.docinsight.core.orchestrator;

import com.docinsight.core.model.Pattern;
import com.docinsight.core.model.SignificanceDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Decides whether a request has patterns important enough to document.
 */
public class SignificanceGate {

    private static final Logger log = LoggerFactory.getLogger(SignificanceGate.class);

    private static final int TOP_PATTERNS = 10;

    private final int threshold;

    public SignificanceGate(int threshold) {
        this.threshold = threshold;
    }

    /**
     * Counts qualifying patterns and builds the score distribution.
     *
     * @param patterns extracted patterns
     * @return diagnostics; {@link SignificanceDiagnostics#qualifies()} tells whether to proceed
     */
    public SignificanceDiagnostics evaluate(List<Pattern> patterns) {
        Map<Integer, Integer> distribution = new TreeMap<>(Collections.reverseOrder());
        for (Pattern pattern : patterns) {
            distribution.merge(pattern.significance(), 1, Integer::sum);
        }

        int significant = (int) patterns.stream().filter(p -> p.significance() >= threshold).count();
        List<String> top = patterns.stream()
            .sorted(Comparator.comparingInt(Pattern::significance).reversed())
            .limit(TOP_PATTERNS)
            .map(p -> "[" + p.significance() + "] " + p.name() + " (" + p.category() + ")")
            .collect(Collectors.toList());

        log.info("Significance distribution of {} pattern(s): {} (threshold {}, {} qualify)",
            patterns.size(), distribution, threshold, significant);
        if (log.isDebugEnabled()) {
            top.forEach(summary -> log.debug("  {}", summary));
        }

        return new SignificanceDiagnostics(threshold, patterns.size(), significant,
            Collections.unmodifiableMap(distribution), top);
    }
}
