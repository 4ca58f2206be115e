package com.flint.service;

import com.flint.dto.SubscriptionResponse;
import com.flint.model.BillingFrequency;
import com.flint.provider.bank.BankTransaction;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class RecurringPaymentDetector {
  static final double MIN_CONFIDENCE = 0.6;
  private static final int MIN_OCCURRENCES = 2;
  private static final int RECENT_TRANSACTIONS = 6;

  private static final Pattern LEADING_NOISE =
      Pattern.compile("^(payment to|autopay|recurring|monthly|subscription)\\s*");
  private static final Pattern TRAILING_NOISE = Pattern.compile("\\s*(payment|autopay|recurring)$");
  private static final Pattern TRAILING_DIGITS = Pattern.compile("\\s*\\d+$");
  private static final Pattern SPECIAL_CHARS = Pattern.compile("[*#]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  // transfers, cash movements and everyday spending that repeats without being a subscription
  private static final List<Pattern> EXCLUSIONS = List.of(
      Pattern.compile("wire transfer|incoming wire|outgoing wire|^wire\\s|\\swire$"),
      Pattern.compile("deposit"),
      Pattern.compile("atm withdrawal"),
      Pattern.compile("check #\\d+"),
      Pattern.compile("gas station|exxon|\\bshell\\b|chevron|\\bbp\\b|mobil|texaco|sunoco|valero|citgo"),
      Pattern.compile("grocery|walmart|\\btarget\\b|kroger|safeway|whole foods|costco|publix|albertsons"),
      Pattern.compile("restaurant|mcdonalds|burger|pizza|starbucks|coffee|chipotle|subway|wendy|taco bell"),
      Pattern.compile("amazon\\.com purchases|amazon marketplace|amzn mktp"),
      Pattern.compile("uber|lyft|taxi|doordash|grubhub|postmates"),
      Pattern.compile("parking|\\btoll\\b"),
      Pattern.compile("cash advance|balance transfer"),
      Pattern.compile("venmo|zelle|paypal|cash app"),
      Pattern.compile("transfer to|transfer from")
  );

  private static final Map<String, List<String>> CATEGORIES = categories();

  private final Clock clock;

  public RecurringPaymentDetector(Clock clock) {
    this.clock = clock;
  }

  public List<SubscriptionResponse> detectSubscriptions(List<BankTransaction> transactions) {
    Map<String, List<BankTransaction>> groups = new LinkedHashMap<>();
    for (BankTransaction transaction : transactions) {
      if (transaction.date() == null || transaction.amount() == null || isExcluded(transaction)) {
        continue;
      }
      String key = merchantKey(transaction);
      if (key.isEmpty()) {
        continue;
      }
      groups.computeIfAbsent(key, ignored -> new ArrayList<>()).add(transaction);
    }

    LocalDate today = LocalDate.now(clock);
    List<SubscriptionResponse> subscriptions = new ArrayList<>();
    for (Map.Entry<String, List<BankTransaction>> group : groups.entrySet()) {
      detect(group.getKey(), group.getValue(), today).ifPresent(subscriptions::add);
    }
    subscriptions.sort(Comparator.comparing(SubscriptionResponse::getMonthlyAmount).reversed());
    return subscriptions;
  }

  public static BigDecimal totalMonthlySpend(List<SubscriptionResponse> subscriptions) {
    return subscriptions.stream()
        .map(SubscriptionResponse::getMonthlyAmount)
        .reduce(BigDecimal.ZERO, BigDecimal::add)
        .setScale(2, RoundingMode.HALF_UP);
  }

  private Optional<SubscriptionResponse> detect(String key, List<BankTransaction> group, LocalDate today) {
    if (group.size() < MIN_OCCURRENCES) {
      return Optional.empty();
    }
    List<BankTransaction> sorted = group.stream()
        .sorted(Comparator.comparing(BankTransaction::date))
        .toList();
    List<Long> intervals = new ArrayList<>();
    for (int i = 1; i < sorted.size(); i++) {
      intervals.add(ChronoUnit.DAYS.between(sorted.get(i - 1).date(), sorted.get(i).date()));
    }

    Optional<Cadence> cadence = classify(intervals);
    if (cadence.isEmpty() || cadence.get().confidence() <= MIN_CONFIDENCE) {
      return Optional.empty();
    }
    BillingFrequency frequency = cadence.get().frequency();
    BankTransaction latest = sorted.get(sorted.size() - 1);
    BigDecimal average = sorted.stream()
        .map(transaction -> transaction.amount().abs())
        .reduce(BigDecimal.ZERO, BigDecimal::add)
        .divide(BigDecimal.valueOf(sorted.size()), 2, RoundingMode.HALF_UP);

    return Optional.of(new SubscriptionResponse(
        subscriptionId(key),
        displayName(key),
        average,
        frequency,
        nextBillingDate(latest.date(), frequency, today),
        latest.date(),
        cadence.get().confidence(),
        categorize(key),
        latest.accountName(),
        frequency.monthlyEquivalent(average),
        sorted.subList(Math.max(0, sorted.size() - RECENT_TRANSACTIONS), sorted.size())));
  }

  static Optional<Cadence> classify(List<Long> intervals) {
    if (intervals.isEmpty()) {
      return Optional.empty();
    }
    for (BillingFrequency frequency : BillingFrequency.values()) {
      long matching = intervals.stream().filter(frequency::matches).count();
      if (frequency == BillingFrequency.YEARLY) {
        if (matching >= 1) {
          return Optional.of(new Cadence(frequency, frequency.maxConfidence()));
        }
        continue;
      }
      double share = (double) matching / intervals.size();
      if (matching > 0 && share >= frequency.requiredShare()) {
        return Optional.of(new Cadence(frequency, Math.min(frequency.maxConfidence(), share)));
      }
    }
    return Optional.empty();
  }

  static LocalDate nextBillingDate(LocalDate last, BillingFrequency frequency, LocalDate today) {
    long periods = 1;
    LocalDate next = frequency.advance(last, periods);
    while (!next.isAfter(today)) {
      periods++;
      next = frequency.advance(last, periods);
    }
    return next;
  }

  static String merchantKey(BankTransaction transaction) {
    String merchant = transaction.merchantName();
    if (merchant != null && !merchant.isBlank()) {
      return WHITESPACE.matcher(merchant.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }
    String description = transaction.description() == null ? "" : transaction.description();
    String key = description.toLowerCase(Locale.ROOT).trim();
    key = LEADING_NOISE.matcher(key).replaceFirst("");
    key = TRAILING_NOISE.matcher(key).replaceFirst("");
    key = TRAILING_DIGITS.matcher(key).replaceFirst("");
    key = SPECIAL_CHARS.matcher(key).replaceAll("");
    return WHITESPACE.matcher(key).replaceAll(" ").trim();
  }

  static boolean isExcluded(BankTransaction transaction) {
    String text = ((transaction.description() == null ? "" : transaction.description()) + " "
        + (transaction.merchantName() == null ? "" : transaction.merchantName())).toLowerCase(Locale.ROOT);
    return EXCLUSIONS.stream().anyMatch(pattern -> pattern.matcher(text).find());
  }

  static String categorize(String key) {
    for (Map.Entry<String, List<String>> category : CATEGORIES.entrySet()) {
      if (category.getValue().stream().anyMatch(key::contains)) {
        return category.getKey();
      }
    }
    return "Other";
  }

  static String displayName(String key) {
    return Arrays.stream(key.split(" "))
        .filter(word -> !word.isEmpty())
        .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
        .collect(Collectors.joining(" "));
  }

  private static String subscriptionId(String key) {
    UUID id = UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    return "sub_" + HexFormat.of().toHexDigits(id.getMostSignificantBits());
  }

  private static Map<String, List<String>> categories() {
    Map<String, List<String>> categories = new LinkedHashMap<>();
    categories.put("Streaming",
        List.of("netflix", "spotify", "hulu", "disney", "amazon prime", "apple music", "youtube", "hbo"));
    categories.put("Utilities",
        List.of("electric", "gas", "water", "internet", "phone", "cable", "verizon", "att", "comcast"));
    categories.put("Software", List.of("adobe", "microsoft", "google", "dropbox", "github", "slack", "zoom"));
    categories.put("Fitness", List.of("gym", "fitness", "peloton", "yoga"));
    categories.put("Financial", List.of("bank", "credit", "loan", "insurance", "investment"));
    return categories;
  }

  record Cadence(BillingFrequency frequency, double confidence) {}
}
