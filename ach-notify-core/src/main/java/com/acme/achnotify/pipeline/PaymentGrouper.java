package com.acme.achnotify.pipeline;

import com.acme.achnotify.domain.BucketEntry;
import com.acme.achnotify.domain.GroupingResult;
import com.acme.achnotify.domain.NormalizedResult;
import com.acme.achnotify.domain.PaymentGroup;
import com.acme.achnotify.domain.PaymentOrder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduce stage. Collects orders sharing a {@code accountId_vendorId} key into one group and
 * passes bucket entries through untouched. Runs after every record was normalized.
 */
public class PaymentGrouper {
  private static final Logger LOG = LoggerFactory.getLogger(PaymentGrouper.class);

  public GroupingResult group(List<NormalizedResult> results) {
    Map<String, List<PaymentOrder>> ordersByKey = new LinkedHashMap<>();
    List<BucketEntry> skipped = new ArrayList<>();
    List<BucketEntry> errored = new ArrayList<>();

    for (NormalizedResult result : results) {
      switch (result.outcome()) {
        case VALID ->
            ordersByKey
                .computeIfAbsent(result.order().groupKey(), k -> new ArrayList<>())
                .add(result.order());
        case SKIPPED -> skipped.add(result.entry());
        case ERRORED -> errored.add(result.entry());
        default -> throw new IllegalStateException("Unknown outcome: " + result.outcome());
      }
    }

    List<PaymentGroup> groups = new ArrayList<>(ordersByKey.size());
    ordersByKey.forEach((key, orders) -> groups.add(reduce(key, orders)));

    LOG.info(
        "Grouped {} records into {} payment groups, {} skipped, {} errored",
        results.size(),
        groups.size(),
        skipped.size(),
        errored.size());
    return new GroupingResult(groups, skipped, errored);
  }

  /** Collapses the orders of one key into a group, keeping their arrival order. */
  public PaymentGroup reduce(String groupKey, List<PaymentOrder> orders) {
    List<String> orderIds = new ArrayList<>(orders.size());
    for (PaymentOrder order : orders) {
      if (!order.groupKey().equals(groupKey)) {
        throw new IllegalArgumentException(
            "Order " + order.orderId() + " belongs to " + order.groupKey() + ", not " + groupKey);
      }
      orderIds.add(order.orderId());
    }
    LOG.debug("Group {} holds transactions {}", groupKey, orderIds);
    return PaymentGroup.fromKey(groupKey, orders.get(0).vendorEmail(), orderIds);
  }
}
