package io.b2mash.transport.backoffice.order;

/**
 * Order lifecycle status. Enforces the valid transitions of the order workflow.
 *
 * <ul>
 *   <li>DRAFT → QUOTED, CANCELLED
 *   <li>QUOTED → CONFIRMED, CANCELLED
 *   <li>CONFIRMED → INVOICED, CANCELLED (entering CONFIRMED spawns missions)
 *   <li>INVOICED → PAID, CANCELLED
 *   <li>PAID and CANCELLED are terminal
 * </ul>
 */
public enum OrderStatus {
  DRAFT,
  QUOTED,
  CONFIRMED,
  INVOICED,
  PAID,
  CANCELLED;

  /**
   * Checks if a transition from the current status to the target status is valid. Staying in the
   * same status is not a transition and returns false.
   */
  public boolean canTransitionTo(OrderStatus target) {
    return switch (this) {
      case DRAFT -> target == QUOTED || target == CANCELLED;
      case QUOTED -> target == CONFIRMED || target == CANCELLED;
      case CONFIRMED -> target == INVOICED || target == CANCELLED;
      case INVOICED -> target == PAID || target == CANCELLED;
      case PAID, CANCELLED -> false;
    };
  }

  public boolean isTerminal() {
    return this == PAID || this == CANCELLED;
  }
}
