package com.acme.mailroute.classify;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-stage translation of stage categories into {@link Department}s. The tables are many-to-one
 * and are not meant to be inverted. Categories without an entry go to {@link Department#IT}.
 *
 * <table>
 *   <caption>Default tables</caption>
 *   <tr><th>stage</th><th>category</th><th>department</th></tr>
 *   <tr><td>domain</td><td>sales</td><td>Sales</td></tr>
 *   <tr><td>domain</td><td>hr</td><td>HR</td></tr>
 *   <tr><td>domain</td><td>finance</td><td>Finance</td></tr>
 *   <tr><td>domain</td><td>it_support</td><td>IT</td></tr>
 *   <tr><td>domain</td><td>legal</td><td>Legal</td></tr>
 *   <tr><td>domain</td><td>marketing</td><td>Marketing</td></tr>
 *   <tr><td>domain</td><td>customer_service, general</td><td>Support</td></tr>
 *   <tr><td>domain</td><td>operations</td><td>Operations</td></tr>
 *   <tr><td>domain</td><td>executive</td><td>Executive</td></tr>
 *   <tr><td>general, baseline</td><td>spam</td><td>IT</td></tr>
 *   <tr><td>general, baseline</td><td>important, updates</td><td>Support</td></tr>
 *   <tr><td>general, baseline</td><td>promotion, social</td><td>Marketing</td></tr>
 * </table>
 */
public class DepartmentDirectory {
  private static final Logger LOG = LoggerFactory.getLogger(DepartmentDirectory.class);

  public static final Department DEFAULT = Department.IT;

  private final Map<String, Map<String, Department>> tables = new HashMap<>();

  public static DepartmentDirectory defaults() {
    DepartmentDirectory d = new DepartmentDirectory();
    d.register(DomainKeywordClassifier.NAME, "sales", Department.SALES);
    d.register(DomainKeywordClassifier.NAME, "hr", Department.HR);
    d.register(DomainKeywordClassifier.NAME, "finance", Department.FINANCE);
    d.register(DomainKeywordClassifier.NAME, "it_support", Department.IT);
    d.register(DomainKeywordClassifier.NAME, "legal", Department.LEGAL);
    d.register(DomainKeywordClassifier.NAME, "marketing", Department.MARKETING);
    d.register(DomainKeywordClassifier.NAME, "customer_service", Department.SUPPORT);
    d.register(DomainKeywordClassifier.NAME, "operations", Department.OPERATIONS);
    d.register(DomainKeywordClassifier.NAME, "executive", Department.EXECUTIVE);
    d.register(DomainKeywordClassifier.NAME, "general", Department.SUPPORT);
    List<String> mailboxStages =
        List.of(GeneralPurposeClassifier.NAME, StatisticalBaselineClassifier.NAME);
    for (String stage : mailboxStages) {
      d.register(stage, MailboxCategory.SPAM, Department.IT);
      d.register(stage, MailboxCategory.IMPORTANT, Department.SUPPORT);
      d.register(stage, MailboxCategory.PROMOTION, Department.MARKETING);
      d.register(stage, MailboxCategory.SOCIAL, Department.MARKETING);
      d.register(stage, MailboxCategory.UPDATES, Department.SUPPORT);
    }
    return d;
  }

  public DepartmentDirectory register(String stage, String category, Department department) {
    tables
        .computeIfAbsent(stage, k -> new HashMap<>())
        .put(category.toLowerCase(Locale.ROOT), department);
    return this;
  }

  public Department departmentFor(String stage, String category) {
    if (category == null) {
      return DEFAULT;
    }
    Department d =
        tables.getOrDefault(stage, Map.of()).get(category.trim().toLowerCase(Locale.ROOT));
    if (d == null) {
      LOG.warn("No department mapping for {}/{}, defaulting to {}", stage, category, DEFAULT);
      return DEFAULT;
    }
    return d;
  }
}
