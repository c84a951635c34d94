package io.tick4j.config;

import io.tick4j.Cadence;
import io.tick4j.JobHandler;
import io.tick4j.runtime.TenantRuntime;

/**
 * Runs a {@link JobHandler} on a cadence taken from {@code tick4j.cadences.<name>}.
 */
record CadenceOverrideJobHandler(JobHandler delegate, Cadence cadence) implements JobHandler {

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public void execute(TenantRuntime tenant) throws Exception {
        delegate.execute(tenant);
    }
}
