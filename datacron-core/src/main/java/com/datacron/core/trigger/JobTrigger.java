package com.datacron.core.trigger;

import com.datacron.core.biz.JobCallBiz;
import com.datacron.core.model.ReturnT;
import com.datacron.core.registry.JobFiring;
import com.datacron.core.registry.JobRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>Executes one job firing</h1>
 *
 * Calls the job's URL once, then records the outcome under the nominal firing time in the
 * registry. Failures end up in the job's status and in the log, never in the caller.
 */
@Slf4j
public class JobTrigger {

    private final JobRegistry jobRegistry;
    private final JobCallBiz jobCallBiz;

    public JobTrigger(JobRegistry jobRegistry, JobCallBiz jobCallBiz) {
        this.jobRegistry = jobRegistry;
        this.jobCallBiz = jobCallBiz;
    }

    public ReturnT<String> trigger(JobFiring firing) {
        ReturnT<String> callResult;
        try {
            callResult = jobCallBiz.call(firing.getUrl());
        } catch (Exception e) {
            log.error(e.getMessage(), e);
            callResult = new ReturnT<>(ReturnT.FAIL_CODE, "GET " + firing.getUrl() + " failed: " + e);
        }

        if (callResult.isSuccess()) {
            log.info(">>>>>>>>>>> datacron, job {} for user {} completed successfully", firing.getJobId(), firing.getTenant());
            jobRegistry.recordOutcome(firing, true, "");
        } else {
            log.warn(">>>>>>>>>>> datacron, job {} for user {} failed: {}", firing.getJobId(), firing.getTenant(), callResult.getMsg());
            jobRegistry.recordOutcome(firing, false, callResult.getMsg());
        }
        return callResult;
    }

    /**
     * Records a firing that never reached the target.
     */
    public void fail(JobFiring firing, String error) {
        log.error(">>>>>>>>>>> datacron, job {} for user {} not triggered: {}", firing.getJobId(), firing.getTenant(), error);
        jobRegistry.recordOutcome(firing, false, error);
    }
}
