package com.datacron.admin.controller;

import com.datacron.admin.service.CronJobService;
import com.datacron.core.model.JobStatus;
import com.datacron.core.model.ReturnT;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.Map;

@Controller
@RequiredArgsConstructor
public class StatusController {

    private final CronJobService cronJobService;

    /**
     * Status of every job of the tenant, keyed by job id.
     */
    @RequestMapping(value = "/status/{user}", method = RequestMethod.GET)
    @ResponseBody
    public ReturnT<Map<String, JobStatus>> status(@PathVariable("user") String user) {
        return new ReturnT<>(cronJobService.status(user));
    }
}
