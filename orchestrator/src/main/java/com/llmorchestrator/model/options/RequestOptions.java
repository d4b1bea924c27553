package com.llmorchestrator.model.options;

/**
 * Common shape of every per-call options object. Options are immutable; the
 * {@code with*} methods return copies.
 */
public interface RequestOptions {

    String getProvider();

    String getModel();

    RequestOptions withProvider(String provider);

    RequestOptions withModel(String model);
}
