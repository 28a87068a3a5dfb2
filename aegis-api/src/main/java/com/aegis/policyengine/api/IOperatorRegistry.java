/*
 * Copyright (c) 2025 Aegis Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.policyengine.api;

/**
 * Read side of the operator registry consumed by the compiler and the cache.
 */
public interface IOperatorRegistry {

    /**
     * Monotonic version; changes whenever operator definitions change.
     */
    long currentVersion();
}
