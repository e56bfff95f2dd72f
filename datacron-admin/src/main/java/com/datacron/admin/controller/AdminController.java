package com.datacron.admin.controller;

import com.datacron.admin.controller.annotation.PermissionLimit;
import com.datacron.admin.core.exception.DataCronException;
import com.datacron.admin.core.model.TenantConfig;
import com.datacron.admin.core.model.UserParam;
import com.datacron.admin.service.TenantService;
import com.datacron.core.cron.CronException;
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
 * Super admin API: users and the whole configuration. {key} is the super admin key.
 */
@Controller
@RequiredArgsConstructor
@RequestMapping("/admin/{key}")
@PermissionLimit(superAdmin = true)
public class AdminController {

    private final TenantService tenantService;

    @RequestMapping(value = "/users", method = RequestMethod.GET)
    @ResponseBody
    public ReturnT<List<String>> users() {
        return new ReturnT<>(tenantService.listUsers());
    }

    @RequestMapping(value = "/users", method = RequestMethod.POST)
    @ResponseBody
    @ResponseStatus(HttpStatus.CREATED)
    public ReturnT<String> createUser(@RequestBody UserParam param) {
        if (param == null) {
            throw DataCronException.badRequest("Invalid request body");
        }
        tenantService.createUser(param.getUser());
        return new ReturnT<>(param.getUser());
    }

    @RequestMapping(value = "/users/{user}", method = RequestMethod.DELETE)
    @ResponseBody
    public ReturnT<String> deleteUser(@PathVariable("user") String user) {
        tenantService.deleteUser(user);
        return ReturnT.SUCCESS;
    }

    @RequestMapping(value = "/config", method = RequestMethod.GET)
    @ResponseBody
    public ReturnT<Map<String, TenantConfig>> config() {
        return new ReturnT<>(tenantService.getConfig());
    }

    @RequestMapping(value = "/config", method = RequestMethod.PUT)
    @ResponseBody
    public ReturnT<String> replaceConfig(@RequestBody Map<String, TenantConfig> config) throws CronException {
        tenantService.replaceConfig(config);
        return ReturnT.SUCCESS;
    }

    @RequestMapping(value = "/reload", method = RequestMethod.GET)
    @ResponseBody
    public ReturnT<String> reload() {
        String path = tenantService.reload();
        return new ReturnT<>("Configuration reloaded from " + path);
    }
}
