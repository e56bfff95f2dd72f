package com.datacron.admin.controller.interceptor;

import com.datacron.admin.controller.annotation.PermissionLimit;
import com.datacron.admin.core.conf.DataCronAdminConfig;
import com.datacron.admin.service.TenantService;
import com.datacron.core.model.ReturnT;
import com.datacron.core.util.GsonTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.AsyncHandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import javax.annotation.Resource;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

/**
 * <h1>Path-key authentication</h1>
 *
 * Admin routes carry the super admin key as {@code {key}}; tenant routes carry the tenant
 * key as {@code {user}}, which is the tenant's name and must belong to an existing tenant.
 * Anything else is answered with 401 before the controller runs.
 */
@Slf4j
@Component
public class PermissionInterceptor implements AsyncHandlerInterceptor {

    @Resource
    private DataCronAdminConfig dataCronAdminConfig;
    @Resource
    private TenantService tenantService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (!(handler instanceof HandlerMethod)) {
            return true;    // static resources, error page
        }
        HandlerMethod method = (HandlerMethod) handler;

        PermissionLimit permission = method.getMethodAnnotation(PermissionLimit.class);
        if (permission == null) {
            permission = method.getBeanType().getAnnotation(PermissionLimit.class);
        }
        boolean needKey = permission == null || permission.limit();
        if (!needKey) {
            return true;
        }

        Map<String, String> pathVariables = pathVariables(request);
        boolean allowed;
        if (permission != null && permission.superAdmin()) {
            String key = pathVariables.get("key");
            allowed = key != null && key.equals(dataCronAdminConfig.getSuperAdminKey());
        } else {
            allowed = tenantService.exists(pathVariables.get("user"));
        }

        if (!allowed) {
            log.debug(">>>>>>>>>>> datacron, unauthorized request {} {}", request.getMethod(), request.getRequestURI());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            response.getWriter().write(GsonTool.toJson(new ReturnT<String>(ReturnT.UNAUTHORIZED_CODE, "Unauthorized")));
            return false;
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> pathVariables(HttpServletRequest request) {
        Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        return attribute instanceof Map ? (Map<String, String>) attribute : Collections.emptyMap();
    }
}
