/**
 * Listener invocation: the callable and method-dispatch variants, per-class
 * handler tables, and interceptors around each invocation.
 *
 * @see eventmanager.dispatch.ListenerTarget
 * @see eventmanager.dispatch.HandlerTable
 * @see eventmanager.dispatch.DispatchInterceptor
 */
package eventmanager.dispatch;
