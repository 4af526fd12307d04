package com.analyseloto.stats.service;

/**
 * Signal d'annulation coopératif, consulté entre deux plis.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();
}
