package io.eventlog.bus;

/**
 * Cross-cutting hook around handler invocation on a sub-bus.
 *
 * <p>Interceptors run around dispatch:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>Handler execution</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeDispatch} throws, the handler is not invoked and the caller
 * receives a {@link HandlerExecutionException}. {@code afterDispatch} exceptions are
 * logged but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * commandBus.addInterceptor(DispatchInterceptor.before(command ->
 *     audit.log(command.commandType())));
 * eventBus.addInterceptor(DispatchInterceptor.after((event, error) -> {
 *     if (error != null) alerts.raise(event.eventId());
 * }));
 * }</pre>
 *
 * @param <T> the dispatched message type
 */
public interface DispatchInterceptor<T> {

  /**
   * Called before the handler is invoked.
   *
   * @param message the message about to be dispatched
   * @throws Exception to abort dispatch
   */
  default void beforeDispatch(T message) throws Exception {
  }

  /**
   * Called after handler invocation, or after a later interceptor's beforeDispatch
   * failed. Not called when this interceptor's own beforeDispatch threw.
   *
   * @param message the message that was dispatched
   * @param error   null on success, the failure otherwise
   */
  default void afterDispatch(T message, Exception error) {
  }

  /**
   * Creates an interceptor with only a beforeDispatch hook.
   */
  static <T> DispatchInterceptor<T> before(BeforeHook<T> hook) {
    return new DispatchInterceptor<>() {
      @Override
      public void beforeDispatch(T message) throws Exception {
        hook.accept(message);
      }
    };
  }

  /**
   * Creates an interceptor with only an afterDispatch hook.
   */
  static <T> DispatchInterceptor<T> after(AfterHook<T> hook) {
    return new DispatchInterceptor<>() {
      @Override
      public void afterDispatch(T message, Exception error) {
        hook.accept(message, error);
      }
    };
  }

  @FunctionalInterface
  interface BeforeHook<T> {
    void accept(T message) throws Exception;
  }

  @FunctionalInterface
  interface AfterHook<T> {
    void accept(T message, Exception error);
  }
}
