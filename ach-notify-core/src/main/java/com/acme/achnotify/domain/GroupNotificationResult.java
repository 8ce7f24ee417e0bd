package com.acme.achnotify.domain;

import java.util.List;

/** What happened to one payment group in the generator. */
public record GroupNotificationResult(
    PaymentGroup group,
    GroupStatus status,
    String dispatchToken,
    List<String> renderedOrderIds,
    List<String> renderFailedOrderIds,
    List<String> flaggedOrderIds,
    List<String> flagFailedOrderIds,
    String errorNote) {

  public GroupNotificationResult {
    renderedOrderIds = copy(renderedOrderIds);
    renderFailedOrderIds = copy(renderFailedOrderIds);
    flaggedOrderIds = copy(flaggedOrderIds);
    flagFailedOrderIds = copy(flagFailedOrderIds);
  }

  public static GroupNotificationResult failed(
      PaymentGroup group, GroupStatus status, String dispatchToken, String errorNote) {
    return new GroupNotificationResult(
        group, status, dispatchToken, List.of(), List.of(), List.of(), List.of(), errorNote);
  }

  public static GroupNotificationResult alreadyDispatched(PaymentGroup group, String dispatchToken) {
    return new GroupNotificationResult(
        group,
        GroupStatus.ALREADY_DISPATCHED,
        dispatchToken,
        List.of(),
        List.of(),
        List.of(),
        List.of(),
        "Already dispatched");
  }

  public int attachmentCount() {
    return renderedOrderIds.size();
  }

  public boolean isNotified() {
    return status == GroupStatus.NOTIFIED;
  }

  private static List<String> copy(List<String> ids) {
    return ids == null ? List.of() : List.copyOf(ids);
  }
}
