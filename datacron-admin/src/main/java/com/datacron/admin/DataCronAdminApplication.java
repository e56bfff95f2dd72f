package com.datacron.admin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author datacron
 */
@SpringBootApplication
public class DataCronAdminApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataCronAdminApplication.class, args);
    }
}
