package com.datacron.core.registry;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Comparator;

/**
 * A pending fire of one job, as queued by the trigger engine. A handle is only honoured
 * while the job's generation in the registry still equals the one recorded here.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class FireHandle {

    public static final Comparator<FireHandle> BY_FIRE_TIME = Comparator
            .comparingLong(FireHandle::getFireTime)
            .thenComparing(FireHandle::getTenant)
            .thenComparing(FireHandle::getJobId);

    private final String tenant;
    private final String jobId;
    private final long generation;
    /** epoch millis */
    private final long fireTime;

    public boolean isFor(String tenant, String jobId) {
        return this.tenant.equals(tenant) && this.jobId.equals(jobId);
    }
}
