package com.questrail.tao.capture;

/**
 * Work performed while an output stream is redirected.
 *
 * @param <E> checked exception the operation may throw
 */
@FunctionalInterface
public interface CapturedOperation<E extends Exception>
{
    void run() throws E;
}
