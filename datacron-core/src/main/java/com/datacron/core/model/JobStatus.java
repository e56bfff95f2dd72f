package com.datacron.core.model;

import com.google.gson.annotations.SerializedName;
import lombok.Data;

import java.util.Date;

/**
 * Execution state of one job. The registry hands out copies only.
 */
@Data
public class JobStatus {

    /** nominal firing time of the most recent attempt */
    @SerializedName("last_run")
    private Date lastRun;

    @SerializedName("last_success")
    private boolean lastSuccess;

    /** empty after a successful attempt */
    @SerializedName("last_error")
    private String lastError;

    /** present only while the job is active */
    @SerializedName("next_run")
    private Date nextRun;

    public JobStatus copy() {
        JobStatus copy = new JobStatus();
        copy.setLastRun(lastRun);
        copy.setLastSuccess(lastSuccess);
        copy.setLastError(lastError);
        copy.setNextRun(nextRun);
        return copy;
    }
}
