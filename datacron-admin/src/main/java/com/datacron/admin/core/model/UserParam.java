package com.datacron.admin.core.model;

import lombok.Data;

/**
 * Body of a user creation request: {@code {"user": "<name>"}}.
 */
@Data
public class UserParam {

    private String user;
}
