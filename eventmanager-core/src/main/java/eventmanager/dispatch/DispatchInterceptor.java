package eventmanager.dispatch;

import eventmanager.EventArgs;

/**
 * Cross-cutting hook around every listener invocation.
 *
 * <p>For each listener of a dispatch:
 * <ol>
 *   <li>{@link #beforeListener} in registration order</li>
 *   <li>Listener execution</li>
 *   <li>{@link #afterListener} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeListener} throws, the listener is skipped and the exception
 * propagates out of the dispatch after the after-hooks ran. {@code afterListener}
 * exceptions are logged but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventManager.builder()
 *     .interceptor(DispatchInterceptor.before((eventName, listener, args) ->
 *         trace.push(eventName, listener)))
 *     .interceptor(DispatchInterceptor.after((eventName, listener, args, error) -> {
 *         if (error != null) alerts.listenerFailed(eventName, error);
 *     }))
 *     .build();
 * }</pre>
 */
public interface DispatchInterceptor {

  /**
   * Called before a listener is invoked.
   *
   * @param eventName the dispatched event
   * @param listener the registered listener object
   * @param args the dispatch payload
   */
  default void beforeListener(String eventName, Object listener, EventArgs args) {
  }

  /**
   * Called after a listener returned or failed.
   *
   * @param eventName the dispatched event
   * @param listener the registered listener object
   * @param args the dispatch payload
   * @param error null on success, otherwise what the listener (or a before-hook) threw
   */
  default void afterListener(String eventName, Object listener, EventArgs args, Throwable error) {
  }

  /**
   * Creates an interceptor with only a beforeListener hook.
   */
  static DispatchInterceptor before(BeforeHook hook) {
    return new DispatchInterceptor() {
      @Override
      public void beforeListener(String eventName, Object listener, EventArgs args) {
        hook.accept(eventName, listener, args);
      }
    };
  }

  /**
   * Creates an interceptor with only an afterListener hook.
   */
  static DispatchInterceptor after(AfterHook hook) {
    return new DispatchInterceptor() {
      @Override
      public void afterListener(String eventName, Object listener, EventArgs args, Throwable error) {
        hook.accept(eventName, listener, args, error);
      }
    };
  }

  @FunctionalInterface
  interface BeforeHook {
    void accept(String eventName, Object listener, EventArgs args);
  }

  @FunctionalInterface
  interface AfterHook {
    void accept(String eventName, Object listener, EventArgs args, Throwable error);
  }
}
