package com.telcomax.assistant.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Regex-based extraction of the entities kept in session memory. Confidence reflects how
 * specific the matching pattern is.
 */
@Component
public class EntityExtractor {

  private static final List<Rule> ACCOUNT_RULES = List.of(
      new Rule(Pattern.compile("\\b(ACC-[A-Z0-9]+-[A-Z0-9]+)\\b", Pattern.CASE_INSENSITIVE), 0.95),
      new Rule(Pattern.compile("\\b(ACC-\\d{9,12})\\b", Pattern.CASE_INSENSITIVE), 0.95),
      new Rule(Pattern.compile("\\baccount\\s+(?:number|#|id)\\s*:?\\s*((?=[A-Z-]*\\d)[A-Z0-9][A-Z0-9-]{3,})\\b",
          Pattern.CASE_INSENSITIVE), 0.7),
      new Rule(Pattern.compile("\\baccount\\s+is\\s+((?=[A-Z-]*\\d)[A-Z0-9][A-Z0-9-]{3,})\\b",
          Pattern.CASE_INSENSITIVE), 0.7));

  private static final List<Rule> NAME_RULES = List.of(
      new Rule(Pattern.compile("(?i:I'm|I am|my name is|this is)\\s+([A-Z][a-z]+)"), 0.8),
      new Rule(Pattern.compile("^([A-Z][a-z]+)\\s+here\\b"), 0.6));

  private static final String MONTHS =
      "January|February|March|April|May|June|July|August|September|October|November|December";

  private static final Pattern PERIOD_MONTH_YEAR = Pattern.compile(
      "\\b(" + MONTHS + "|Jan|Feb|Mar|Apr|Jun|Jul|Aug|Sep|Oct|Nov|Dec)\\s+(\\d{4})\\b",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern PERIOD_MONTH_BILL = Pattern.compile(
      "\\b(" + MONTHS + ")\\s+bill\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern PERIOD_RELATIVE = Pattern.compile(
      "\\b(this month|last month|current month|previous month)\\b", Pattern.CASE_INSENSITIVE);

  private static final Map<String, List<String>> TOPIC_KEYWORDS = new LinkedHashMap<>();

  static {
    TOPIC_KEYWORDS.put("billing",
        List.of("bill", "invoice", "charge", "payment", "amount", "due", "balance"));
    TOPIC_KEYWORDS.put("plans", List.of("plan", "upgrade", "downgrade", "package", "subscription"));
    TOPIC_KEYWORDS.put("dispute",
        List.of("dispute", "wrong", "incorrect", "error", "overcharge", "refund"));
    TOPIC_KEYWORDS.put("late_fee", List.of("late", "fee", "penalty", "overdue"));
    TOPIC_KEYWORDS.put("support", List.of("help", "support", "issue", "problem", "question"));
  }

  public List<Entity> extract(String text) {
    List<Entity> found = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return found;
    }

    firstMatch(ACCOUNT_RULES, text)
        .ifPresent(m -> found.add(new Entity(EntityType.ACCOUNT_ID,
            m.value().toUpperCase(Locale.ROOT), m.confidence())));
    firstMatch(NAME_RULES, text)
        .ifPresent(m -> found.add(new Entity(EntityType.CUSTOMER_NAME, m.value(), m.confidence())));

    Entity period = extractPeriod(text);
    if (period != null) {
      found.add(period);
    }
    Entity topic = extractTopic(text);
    if (topic != null) {
      found.add(topic);
    }
    return found;
  }

  private Entity extractPeriod(String text) {
    Matcher matcher = PERIOD_MONTH_YEAR.matcher(text);
    if (matcher.find()) {
      return new Entity(EntityType.BILLING_PERIOD,
          capitalize(matcher.group(1)) + " " + matcher.group(2), 0.9);
    }
    matcher = PERIOD_MONTH_BILL.matcher(text);
    if (matcher.find()) {
      return new Entity(EntityType.BILLING_PERIOD, capitalize(matcher.group(1)), 0.7);
    }
    matcher = PERIOD_RELATIVE.matcher(text);
    if (matcher.find()) {
      return new Entity(EntityType.BILLING_PERIOD, matcher.group(1).toLowerCase(Locale.ROOT), 0.5);
    }
    return null;
  }

  private Entity extractTopic(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    String best = null;
    int bestScore = 0;
    for (Map.Entry<String, List<String>> entry : TOPIC_KEYWORDS.entrySet()) {
      int score = (int) entry.getValue().stream().filter(lower::contains).count();
      if (score > bestScore) {
        best = entry.getKey();
        bestScore = score;
      }
    }
    // keyword hits are weak evidence; a later, clearer topic should replace this one
    return best == null ? null : new Entity(EntityType.TOPIC, best, 0.5);
  }

  private static Optional<Match> firstMatch(List<Rule> rules, String text) {
    for (Rule rule : rules) {
      Matcher matcher = rule.pattern().matcher(text);
      if (matcher.find()) {
        return Optional.of(new Match(matcher.group(1), rule.confidence()));
      }
    }
    return Optional.empty();
  }

  private static String capitalize(String word) {
    String lower = word.toLowerCase(Locale.ROOT);
    return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
  }

  private record Rule(Pattern pattern, double confidence) {}

  private record Match(String value, double confidence) {}
}
