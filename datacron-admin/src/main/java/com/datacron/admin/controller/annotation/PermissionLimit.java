package com.datacron.admin.controller.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Access rule of a handler, on the method or on its controller (the method wins).
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface PermissionLimit {

    /**
     * whether a key is required at all; true by default
     */
    boolean limit() default true;

    /**
     * true: the {key} path variable must be the super admin key;
     * false: the {user} path variable must name an existing user
     */
    boolean superAdmin() default false;
}
