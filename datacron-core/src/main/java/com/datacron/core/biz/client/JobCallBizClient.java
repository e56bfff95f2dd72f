package com.datacron.core.biz.client;

import com.datacron.core.biz.JobCallBiz;
import com.datacron.core.model.ReturnT;
import com.datacron.core.util.JobRemotingUtil;

/**
 * datacron => job target, over plain HTTP GET.
 */
public class JobCallBizClient implements JobCallBiz {

    public static final int DEFAULT_TIMEOUT = 30;

    private final int timeout; // seconds

    public JobCallBizClient(int timeout) {
        this.timeout = timeout > 0 ? timeout : DEFAULT_TIMEOUT;
    }

    @Override
    public ReturnT<String> call(String url) {
        return JobRemotingUtil.get(url, timeout);
    }
}
