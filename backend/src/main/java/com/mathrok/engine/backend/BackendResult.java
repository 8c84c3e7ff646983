package com.mathrok.engine.backend;

/**
 * A value produced by the named backend.
 */
public record BackendResult<T>(String backend, T value) {
}
