package com.datacron.admin.controller;

import com.datacron.admin.core.model.CronJobView;
import com.datacron.admin.service.CronJobService;
import com.datacron.core.cron.CronException;
import com.datacron.core.model.CronJob;
import com.datacron.core.model.ReturnT;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;
import java.util.Map;

/**
 * Tenant API for jobs. {user} is the tenant key.
 */
@Controller
@RequiredArgsConstructor
@RequestMapping("/cron/{user}")
public class CronJobController {

    private final CronJobService cronJobService;

    @RequestMapping(value = "/jobs", method = RequestMethod.GET)
    @ResponseBody
    public ReturnT<List<CronJob>> list(@PathVariable("user") String user) {
        return new ReturnT<>(cronJobService.list(user));
    }

    @RequestMapping(value = "/jobs", method = RequestMethod.POST)
    @ResponseBody
    @ResponseStatus(HttpStatus.CREATED)
    public ReturnT<CronJob> add(@PathVariable("user") String user, @RequestBody CronJob job) throws CronException {
        return new ReturnT<>(cronJobService.add(user, job));
    }

    @RequestMapping(value = "/jobs", method = RequestMethod.PUT)
    @ResponseBody
    public ReturnT<List<CronJob>> replaceAll(@PathVariable("user") String user, @RequestBody List<CronJob> jobs) throws CronException {
        return new ReturnT<>(cronJobService.replaceAll(user, jobs));
    }

    @RequestMapping(value = "/job/{id}", method = RequestMethod.GET)
    @ResponseBody
    public ReturnT<CronJobView> load(@PathVariable("user") String user, @PathVariable("id") String id) {
        return new ReturnT<>(cronJobService.load(user, id));
    }

    @RequestMapping(value = "/job/{id}", method = RequestMethod.PUT)
    @ResponseBody
    public ReturnT<CronJob> update(@PathVariable("user") String user, @PathVariable("id") String id,
                                   @RequestBody CronJob job) throws CronException {
        return new ReturnT<>(cronJobService.update(user, id, job));
    }

    @RequestMapping(value = "/job/{id}", method = RequestMethod.DELETE)
    @ResponseBody
    public ReturnT<String> remove(@PathVariable("user") String user, @PathVariable("id") String id) {
        cronJobService.remove(user, id);
        return ReturnT.SUCCESS;
    }

    @RequestMapping(value = "/all/on", method = RequestMethod.GET)
    @ResponseBody
    public ReturnT<Map<String, Object>> startAll(@PathVariable("user") String user) {
        return new ReturnT<>(cronJobService.setAllActive(user, true));
    }

    @RequestMapping(value = "/all/off", method = RequestMethod.GET)
    @ResponseBody
    public ReturnT<Map<String, Object>> stopAll(@PathVariable("user") String user) {
        return new ReturnT<>(cronJobService.setAllActive(user, false));
    }

    @RequestMapping(value = "/{id}/on", method = RequestMethod.GET)
    @ResponseBody
    public ReturnT<Map<String, Object>> start(@PathVariable("user") String user, @PathVariable("id") String id) throws CronException {
        return new ReturnT<>(cronJobService.setActive(user, id, true));
    }

    @RequestMapping(value = "/{id}/off", method = RequestMethod.GET)
    @ResponseBody
    public ReturnT<Map<String, Object>> stop(@PathVariable("user") String user, @PathVariable("id") String id) throws CronException {
        return new ReturnT<>(cronJobService.setActive(user, id, false));
    }
}
