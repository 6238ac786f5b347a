package io.eventlog.bus;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered interceptor chain shared by the sub-bus implementations.
 *
 * @param <T> the dispatched message type
 */
public final class Interceptors<T> {
  private static final Logger logger = Logger.getLogger(Interceptors.class.getName());

  private final List<DispatchInterceptor<T>> chain = new CopyOnWriteArrayList<>();

  public void add(DispatchInterceptor<T> interceptor) {
    chain.add(Objects.requireNonNull(interceptor, "interceptor"));
  }

  public int size() {
    return chain.size();
  }

  public void clear() {
    chain.clear();
  }

  /**
   * Runs {@code action} inside the chain. Before hooks run in registration order;
   * after hooks run in reverse order for every interceptor whose before hook
   * completed. An interceptor whose before hook threw gets no after hook.
   *
   * @throws Exception the first before-hook failure, or the action's failure
   */
  public <R> R invoke(T message, Callable<R> action) throws Exception {
    List<DispatchInterceptor<T>> snapshot = List.copyOf(chain);
    int entered = 0;
    Exception error = null;
    try {
      for (DispatchInterceptor<T> interceptor : snapshot) {
        interceptor.beforeDispatch(message);
        entered++;
      }
      return action.call();
    } catch (Exception e) {
      error = e;
      throw e;
    } finally {
      for (int i = entered - 1; i >= 0; i--) {
        try {
          snapshot.get(i).afterDispatch(message, error);
        } catch (RuntimeException ex) {
          logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
        }
      }
    }
  }
}
