package com.codeheadsystems.smartaccount.core.module;

/**
 * Marker for modules that submit operations through
 * {@code AccountManager.executeFromExecutor} once installed as an executor.
 */
public interface ExecutorModule extends Module {
}
