package com.datacron.admin.core.conf;

import com.datacron.core.util.GsonTool;
import com.google.gson.Gson;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The REST API speaks the same JSON as the configuration file.
 */
@Configuration
public class GsonConfig {

    @Bean
    public Gson gson() {
        return GsonTool.getGson();
    }
}
