package com.datacron.core.biz;

import com.datacron.core.model.ReturnT;

/**
 * Performs the call behind one job firing.
 */
public interface JobCallBiz {

    /**
     * @return {@link ReturnT#SUCCESS_CODE} when the target answered with a 2xx status,
     *         {@link ReturnT#FAIL_CODE} and a message otherwise
     */
    ReturnT<String> call(String url);
}
