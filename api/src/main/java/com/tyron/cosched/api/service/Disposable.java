package com.tyron.cosched.api.service;

/**
 * Something that holds resources (threads, pending host callbacks, queued work) and must be
 * released explicitly.
 * <p>
 * Implementations should make {@link #dispose()} idempotent.
 */
public interface Disposable {

    void dispose();
}
