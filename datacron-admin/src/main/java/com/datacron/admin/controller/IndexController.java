package com.datacron.admin.controller;

import com.datacron.admin.controller.annotation.PermissionLimit;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.ResponseBody;

@Controller
public class IndexController {

    /**
     * Liveness probe, no key required.
     */
    @RequestMapping(value = "/health", method = RequestMethod.GET)
    @ResponseBody
    @PermissionLimit(limit = false)
    public String health() {
        return "OK";
    }
}
