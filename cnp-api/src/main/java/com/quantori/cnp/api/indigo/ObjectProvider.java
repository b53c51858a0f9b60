package com.quantori.cnp.api.indigo;

import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import lombok.SneakyThrows;

public class ObjectProvider<E> {

  private final ObjectPool<E> objectPool;

  /**
   * How long to wait to take an object before giving up in units of seconds
   */
  private final int timeout;

  public ObjectProvider(ObjectPool<E> objectPool, int timeoutInSeconds) {

    this.objectPool = objectPool;
    this.timeout = timeoutInSeconds;
  }

  /**
   * Borrows an object from the pool. Blocks until an object is available or the timeout elapses.
   *
   * @return a pooled object that must be given back with {@link #offer(Object)}
   */
  @SneakyThrows(InterruptedException.class)
  public E take() {

    return objectPool.acquire(timeout, TimeUnit.SECONDS);
  }

  public void offer(E element) {

    objectPool.release(element);
  }

  /**
   * Runs a function with a borrowed object and gives the object back afterwards.
   *
   * @param function work to perform
   * @param <R>      result type
   * @return the function result
   */
  public <R> R apply(Function<E, R> function) {

    E element = take();
    try {
      return function.apply(element);
    } finally {
      offer(element);
    }
  }

  public int availableCount() {
    return objectPool.availableCount();
  }
}
