package com.datacron.admin.core.model;

import com.datacron.core.model.CronJob;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything stored for one tenant in the configuration file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TenantConfig {

    private List<CronJob> cron = new ArrayList<>();
    private Map<String, Object> data = new LinkedHashMap<>();
}
