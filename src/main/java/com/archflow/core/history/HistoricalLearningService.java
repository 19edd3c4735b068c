package com.archflow.core.history;

import com.archflow.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns past deployment feedback for similar requirements into a markdown block the
 * design agent can read. Never fails: timeouts and store errors yield an empty string.
 */
public class HistoricalLearningService {

    private static final Logger log = LoggerFactory.getLogger(HistoricalLearningService.class);

    private static final int MAX_KEYWORDS = 20;
    private static final int HIGH_RATING = 4;
    private static final int LOW_RATING = 2;
    private static final int MAX_INSIGHTS = 5;
    private static final double MIN_SIMILARITY = 0.1;

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "was", "are", "were", "been",
            "be", "have", "has", "had", "do", "does", "did", "will", "would",
            "could", "should", "may", "might", "must", "shall", "can", "need",
            "i", "me", "my", "we", "our", "you", "your", "it", "its", "this",
            "that", "these", "those", "which", "what", "who", "whom", "when",
            "where", "why", "how", "all", "each", "every", "both", "few", "more",
            "most", "other", "some", "such", "no", "nor", "not", "only", "own",
            "same", "so", "than", "too", "very", "just", "also", "now", "here",
            "want", "build", "create", "system", "application", "app", "service",
            "use", "using", "needs", "like", "please", "help", "make");

    private static final List<Pattern> TECH_PATTERNS = List.of(
            Pattern.compile("\\b(kubernetes|k8s|docker|container)\\b"),
            Pattern.compile("\\b(azure|aws|gcp|cloud)\\b"),
            Pattern.compile("\\b(api|rest|graphql|grpc)\\b"),
            Pattern.compile("\\b(database|sql|nosql|redis|cosmos|dynamo)\\b"),
            Pattern.compile("\\b(authentication|auth|oauth|jwt)\\b"),
            Pattern.compile("\\b(microservice|monolith|serverless|lambda)\\b"),
            Pattern.compile("\\b(ci/cd|pipeline|deployment|terraform)\\b"),
            Pattern.compile("\\b(load.?balancer|cdn|cache|queue)\\b"),
            Pattern.compile("\\b(real.?time|streaming|event.?driven)\\b"),
            Pattern.compile("\\b(web|mobile|frontend|backend)\\b"),
            Pattern.compile("\\b(scale|scaling|high.?availability|ha)\\b"),
            Pattern.compile("\\b(security|encryption|firewall|waf)\\b"));

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s-]");

    private final HistoricalFeedbackStore store;
    private final PipelineProperties.History properties;
    private final ExecutorService executor;

    public HistoricalLearningService(HistoricalFeedbackStore store, PipelineProperties.History properties,
                                     ExecutorService executor) {
        this.store = store;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Returns the formatted historical context for the requirements, or an empty string.
     */
    public String contextFor(String requirements) {
        if (requirements == null || requirements.isBlank()) {
            return "";
        }
        List<String> keywords = extractKeywords(requirements);
        if (keywords.isEmpty()) {
            return "";
        }
        CompletableFuture<List<FeedbackRecord>> query = CompletableFuture.supplyAsync(
                () -> store.query(keywords, properties.getMaxResults() * 2), executor);
        try {
            List<FeedbackRecord> records = query.get(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return format(analyze(keywords, records));
        } catch (TimeoutException e) {
            query.cancel(true);
            log.warn("Historical feedback query timed out after {}", properties.getTimeout());
            return "";
        } catch (InterruptedException e) {
            query.cancel(true);
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException e) {
            log.warn("Historical feedback query failed: {}", e.getCause().getMessage());
            return "";
        }
    }

    static List<String> extractKeywords(String requirements) {
        String lower = requirements.toLowerCase(Locale.ROOT);
        Set<String> keywords = new LinkedHashSet<>();
        for (String word : NON_WORD.matcher(lower).replaceAll(" ").split("\\s+")) {
            if (word.length() >= 3 && !STOP_WORDS.contains(word) && !word.chars().allMatch(Character::isDigit)) {
                keywords.add(word);
            }
        }
        for (Pattern pattern : TECH_PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            while (matcher.find()) {
                keywords.add(matcher.group(1));
            }
        }
        return keywords.stream().limit(MAX_KEYWORDS).toList();
    }

    static double similarity(List<String> keywords, FeedbackRecord record) {
        if (record.summary() == null || record.summary().isBlank()) {
            return 0.0;
        }
        Set<String> theirs = new HashSet<>(extractKeywords(record.summary()));
        Set<String> ours = new HashSet<>(keywords);
        if (theirs.isEmpty() || ours.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(ours);
        union.addAll(theirs);
        ours.retainAll(theirs);
        double score = (double) ours.size() / union.size();
        return ours.size() >= 3 ? Math.min(1.0, score * 1.2) : score;
    }

    private Insights analyze(List<String> keywords, List<FeedbackRecord> records) {
        List<FeedbackRecord> similar = records.stream()
                .filter(r -> similarity(keywords, r) > MIN_SIMILARITY)
                .sorted(Comparator.comparingDouble((FeedbackRecord r) -> similarity(keywords, r)).reversed())
                .limit(properties.getMaxResults())
                .toList();

        List<String> successes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, Integer> issueCounts = new LinkedHashMap<>();
        for (FeedbackRecord record : similar) {
            boolean successful = record.outcomeRating() >= HIGH_RATING && record.success();
            boolean problematic = !successful && (record.outcomeRating() <= LOW_RATING || !record.success());
            if (successful) {
                addIfPresent(successes, truncate(record.modificationsMade(), 200), record);
                if (record.comments() != null && record.comments().strip().length() > 20) {
                    successes.add("User feedback: " + truncate(record.comments(), 200));
                }
            } else if (problematic) {
                record.issuesEncountered().forEach(issue -> {
                    if (!issue.isBlank()) {
                        warnings.add(truncate(issue, 150));
                    }
                });
                if (record.outcomeRating() <= LOW_RATING && record.comments() != null
                        && record.comments().strip().length() > 20) {
                    warnings.add("User reported: " + truncate(record.comments(), 150));
                }
            }
            for (String issue : record.issuesEncountered()) {
                String key = truncate(issue.toLowerCase(Locale.ROOT), 100);
                if (!key.isEmpty()) {
                    issueCounts.merge(key, 1, Integer::sum);
                }
            }
        }
        List<String> commonIssues = issueCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(MAX_INSIGHTS)
                .map(Map.Entry::getKey)
                .toList();
        return new Insights(similar.size(),
                successes.stream().distinct().limit(MAX_INSIGHTS).toList(),
                warnings.stream().distinct().limit(MAX_INSIGHTS).toList(),
                commonIssues);
    }

    private String format(Insights insights) {
        if (insights.analyzed() < properties.getMinFeedback()
                && insights.successes().isEmpty() && insights.warnings().isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        sb.append("## Historical Learning from Past Deployments\n\n");
        sb.append("Based on ").append(insights.analyzed())
                .append(" similar past designs, here are insights to consider:\n\n");
        if (!insights.successes().isEmpty()) {
            sb.append("### Patterns That Worked Well (from successful deployments rated 4-5 stars):\n");
            insights.successes().forEach(s -> sb.append("- ").append(s).append('\n'));
            sb.append('\n');
        }
        if (!insights.warnings().isEmpty()) {
            sb.append("### Patterns to Avoid (from deployments with issues):\n");
            insights.warnings().forEach(w -> sb.append("- **Warning**: ").append(w).append('\n'));
            sb.append('\n');
        }
        if (!insights.commonIssues().isEmpty()) {
            sb.append("### Common Issues Encountered:\n");
            insights.commonIssues().forEach(i -> sb.append("- ").append(i).append('\n'));
            sb.append('\n');
        }
        sb.append("Apply these learnings while designing, but use your judgment - every project is different.\n");
        return sb.toString();
    }

    private static void addIfPresent(List<String> target, String text, FeedbackRecord record) {
        if (!text.isEmpty()) {
            target.add(text + " (rating: " + record.outcomeRating() + "/5)");
        }
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        String stripped = text.strip();
        return stripped.length() > max ? stripped.substring(0, max) : stripped;
    }

    private record Insights(int analyzed, List<String> successes, List<String> warnings,
                            List<String> commonIssues) {}
}
