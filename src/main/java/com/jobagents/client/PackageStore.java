package com.jobagents.client;

import com.jobagents.core.Result;
import com.jobagents.model.ApplicationPackage;

/**
 * Durable record of generated documents.
 */
public interface PackageStore {

    /**
     * @return the id assigned to the stored record, or a failure
     */
    Result<Long> persist(ApplicationPackage record);
}
