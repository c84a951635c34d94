package io.tick4j;

import io.tick4j.runtime.TenantRuntime;

/**
 * Feature-level job definition, instantiated once per tenant.
 *
 * <p>The job is enabled for a tenant while the feature named {@link #name()} is enabled.
 */
public interface JobHandler {

    String name();

    Cadence cadence();

    void execute(TenantRuntime tenant) throws Exception;
}
