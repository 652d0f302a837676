package eventmanager;

/**
 * Payload passed to every listener invoked during a dispatch.
 *
 * <p>The base class carries no data besides the propagation flag. Applications
 * subclass it to hand domain objects to their listeners:
 *
 * <pre>{@code
 * public class OrderPlacedArgs extends EventArgs {
 *   private final Order order;
 *
 *   public OrderPlacedArgs(Order order) {
 *     this.order = order;
 *   }
 *
 *   public Order order() {
 *     return order;
 *   }
 * }
 *
 * eventManager.dispatch("orderPlaced", new OrderPlacedArgs(order));
 * }</pre>
 *
 * <p>Instances are mutable and not thread-safe. The caller of
 * {@link EventManager#dispatch(String, EventArgs)} keeps the same reference and can
 * inspect it once dispatch returns.
 */
public class EventArgs {
  private boolean propagationStopped;

  /**
   * Returns a new payload without data and with propagation not stopped.
   */
  public static EventArgs empty() {
    return new EventArgs();
  }

  /**
   * Stops the current dispatch after the invoking listener returns. Listeners
   * ordered after it are not called for this dispatch but stay registered.
   */
  public void stopPropagation() {
    propagationStopped = true;
  }

  public boolean isPropagationStopped() {
    return propagationStopped;
  }
}
