package com.datacron.admin.controller;

import com.datacron.admin.service.TenantDataService;
import com.datacron.core.model.ReturnT;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.List;

/**
 * Tenant API for the key/value data. {user} is the tenant key.
 */
@Controller
@RequiredArgsConstructor
@RequestMapping("/data/{user}")
public class DataController {

    private final TenantDataService tenantDataService;

    @RequestMapping(value = "/keys", method = RequestMethod.GET)
    @ResponseBody
    public ReturnT<List<String>> keys(@PathVariable("user") String user) {
        return new ReturnT<>(tenantDataService.keys(user));
    }

    @RequestMapping(value = "/{key}", method = RequestMethod.GET)
    @ResponseBody
    public ReturnT<Object> get(@PathVariable("user") String user, @PathVariable("key") String key) {
        return new ReturnT<>(tenantDataService.get(user, key));
    }

    @RequestMapping(value = "/{key}", method = RequestMethod.PUT)
    @ResponseBody
    public ReturnT<String> put(@PathVariable("user") String user, @PathVariable("key") String key,
                               @RequestBody Object value) {
        tenantDataService.put(user, key, value);
        return ReturnT.SUCCESS;
    }

    @RequestMapping(value = "/{key}", method = RequestMethod.DELETE)
    @ResponseBody
    public ReturnT<String> delete(@PathVariable("user") String user, @PathVariable("key") String key) {
        tenantDataService.delete(user, key);
        return ReturnT.SUCCESS;
    }
}
