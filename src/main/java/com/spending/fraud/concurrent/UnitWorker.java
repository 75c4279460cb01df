package com.spending.fraud.concurrent;

/**
 * Processes one unit of work. May throw; the pool records the failure against the unit.
 *
 * @param <T> unit type
 * @param <R> result type
 */
@FunctionalInterface
public interface UnitWorker<T, R> {

    R process(T unit) throws Exception;
}
