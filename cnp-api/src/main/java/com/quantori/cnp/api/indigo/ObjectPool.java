package com.quantori.cnp.api.indigo;

import com.quantori.cnp.api.indigo.exception.ObjectPoolException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Fixed size pool of objects that are not thread safe, each borrowed by one thread at a time.
 * <p>
 * Every element is tracked by an id so that releasing an element twice, or releasing a foreign element, is detected.
 */
public class ObjectPool<E> {

  private final BlockingQueue<E> available;
  private final ConcurrentHashMap<Long, Boolean> borrowed;
  private final Function<E, Long> idFunction;

  ObjectPool(int size, Supplier<E> factory, Function<E, Long> idFunction) {

    this.available = new LinkedBlockingQueue<>(size);
    this.borrowed = new ConcurrentHashMap<>();
    this.idFunction = idFunction;

    for (int i = 0; i < size; i++) {
      E element = factory.get();
      available.offer(element);
      borrowed.put(idFunction.apply(element), Boolean.FALSE);
    }
  }

  /**
   * Takes an element out of the pool, waiting for the given time if all elements are borrowed.
   *
   * @param timeout how long to wait before giving up, in units of {@code unit}
   * @param unit    a {@code TimeUnit} determining how to interpret the {@code timeout} parameter
   * @return a borrowed element
   * @throws InterruptedException if interrupted while waiting
   * @throws ObjectPoolException  if no element became available in time
   */
  public E acquire(long timeout, TimeUnit unit) throws InterruptedException {

    E element = available.poll(timeout, unit);
    if (Objects.isNull(element)) {
      throw new ObjectPoolException("No pooled object became available within " + timeout + " " + unit);
    }
    if (!borrowed.replace(idFunction.apply(element), Boolean.FALSE, Boolean.TRUE)) {
      throw new ObjectPoolException("Pooled object " + idFunction.apply(element) + " is already borrowed");
    }
    return element;
  }

  /**
   * Returns a borrowed element to the pool.
   *
   * @param element the element taken by {@link #acquire(long, TimeUnit)}
   * @throws ObjectPoolException if the element is not borrowed from this pool
   */
  public void release(E element) {

    if (!borrowed.replace(idFunction.apply(element), Boolean.TRUE, Boolean.FALSE)) {
      throw new ObjectPoolException("Object " + idFunction.apply(element) + " is not borrowed from this pool");
    }
    available.add(element);
  }

  public int availableCount() {
    return available.size();
  }
}
