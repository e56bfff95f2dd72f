package com.datacron.admin.controller;

import com.datacron.admin.core.conf.DataCronAdminConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "datacron.super-admin-key=test-admin",
        "datacron.auto-save-interval=3600",
        "datacron.trigger.timeout=1",
        "datacron.timezone=UTC",
        "logging.config=classpath:logback-test.xml"
})
@AutoConfigureMockMvc
class DataCronApiTest {

    private static final String ADMIN = "/admin/test-admin";

    /** never fires during a test run */
    private static final String YEARLY = "0 0 0 1 1 *";

    private static final Path CONFIG_DIR;

    static {
        try {
            CONFIG_DIR = Files.createTempDirectory("datacron-api");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void configFile(DynamicPropertyRegistry registry) {
        registry.add("datacron.config-file-path", () -> CONFIG_DIR.resolve("config.json").toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DataCronAdminConfig dataCronAdminConfig;

    private ResultActions createUser(String user) throws Exception {
        return mockMvc.perform(post(ADMIN + "/users")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"user\": \"" + user + "\"}"));
    }

    private ResultActions addJob(String user, String json) throws Exception {
        return mockMvc.perform(post("/cron/" + user + "/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json));
    }

    private static String job(String id, String cron, boolean active) {
        return "{\"id\": \"" + id + "\", \"cron\": \"" + cron + "\", \"url\": \"http://127.0.0.1:1/" + id
                + "\", \"active\": " + active + "}";
    }

    @Test
    void healthNeedsNoKey() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }

    @Test
    void adminRoutesNeedTheSuperAdminKey() throws Exception {
        mockMvc.perform(get("/admin/wrong/users"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value(401));
        mockMvc.perform(get(ADMIN + "/users"))
                .andExpect(status().isOk());
    }

    @Test
    void tenantRoutesNeedAnExistingTenant() throws Exception {
        mockMvc.perform(get("/status/ghost")).andExpect(status().isUnauthorized());
        mockMvc.perform(get("/cron/ghost/jobs")).andExpect(status().isUnauthorized());
        mockMvc.perform(get("/data/ghost/keys")).andExpect(status().isUnauthorized());
    }

    @Test
    void userLifecycle() throws Exception {
        createUser("erin").andExpect(status().isCreated());
        mockMvc.perform(get(ADMIN + "/users"))
                .andExpect(jsonPath("$.content", hasItem("erin")));
        mockMvc.perform(get("/status/erin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").isEmpty());

        mockMvc.perform(delete(ADMIN + "/users/erin")).andExpect(status().isOk());
        mockMvc.perform(delete(ADMIN + "/users/erin")).andExpect(status().isNotFound());
        mockMvc.perform(get("/status/erin")).andExpect(status().isUnauthorized());
        mockMvc.perform(get(ADMIN + "/users"))
                .andExpect(jsonPath("$.content", not(hasItem("erin"))));
    }

    @Test
    void createUserWithoutNameIsRejected() throws Exception {
        mockMvc.perform(post(ADMIN + "/users").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post(ADMIN + "/users").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.msg").value("Invalid request body"));
    }

    @Test
    void jobLifecycle() throws Exception {
        createUser("alice");

        addJob("alice", job("report", "** 0 0 1 1 *", false))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.content.cron").value("* 0 0 1 1 *"));
        addJob("alice", job("report", "0 0 0 1 1 *", false))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/cron/alice/job/report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content.id").value("report"))
                .andExpect(jsonPath("$.content.cron").value(YEARLY))
                .andExpect(jsonPath("$.content.active").value(false))
                .andExpect(jsonPath("$.content.status.next_run").doesNotExist());

        mockMvc.perform(get("/cron/alice/report/on"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content.action").value("activated"))
                .andExpect(jsonPath("$.content.active").value(true));
        mockMvc.perform(get("/status/alice"))
                .andExpect(jsonPath("$.content.report.next_run").exists())
                .andExpect(jsonPath("$.content.report.last_run").doesNotExist());

        mockMvc.perform(get("/cron/alice/report/off"))
                .andExpect(jsonPath("$.content.action").value("deactivated"));
        mockMvc.perform(get("/status/alice"))
                .andExpect(jsonPath("$.content.report.next_run").doesNotExist());

        mockMvc.perform(put("/cron/alice/job/report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cron\": \"0 30 * * * *\", \"url\": \"http://127.0.0.1:1/new\", \"active\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content.id").value("report"))
                .andExpect(jsonPath("$.content.url").value("http://127.0.0.1:1/new"));

        mockMvc.perform(delete("/cron/alice/job/report")).andExpect(status().isOk());
        mockMvc.perform(delete("/cron/alice/job/report")).andExpect(status().isNotFound());
        mockMvc.perform(get("/cron/alice/job/report")).andExpect(status().isNotFound());
        mockMvc.perform(get("/cron/alice/report/on")).andExpect(status().isNotFound());
    }

    @Test
    void invalidJobsAreRejected() throws Exception {
        createUser("bob");

        addJob("bob", job("bad", "61 * * * * *", true))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));
        addJob("bob", job("bad", "* * *", true))
                .andExpect(status().isBadRequest());
        addJob("bob", "{\"id\": \"nourl\", \"cron\": \"* * * * *\", \"active\": true}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.msg").value("URL is required"));
        addJob("bob", "{\"cron\": \"* * * * *\", \"url\": \"http://x\"}")
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/cron/bob/jobs"))
                .andExpect(jsonPath("$.content").isEmpty());
    }

    @Test
    void bulkOperations() throws Exception {
        createUser("carol");

        mockMvc.perform(put("/cron/carol/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + job("a", YEARLY, true) + "," + job("b", YEARLY, true) + "," + job("c", YEARLY, false) + "]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content.length()").value(3));

        mockMvc.perform(get("/cron/carol/all/off"))
                .andExpect(jsonPath("$.content.count").value(3))
                .andExpect(jsonPath("$.content.changed").value(2));
        mockMvc.perform(get("/status/carol"))
                .andExpect(jsonPath("$.content.length()").value(3))
                .andExpect(jsonPath("$.content.a.next_run").doesNotExist());

        mockMvc.perform(get("/cron/carol/all/on"))
                .andExpect(jsonPath("$.content.changed").value(3));

        mockMvc.perform(put("/cron/carol/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[" + job("a", YEARLY, true) + "," + job("z", "bad cron here", true) + "]"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/cron/carol/jobs"))
                .andExpect(jsonPath("$.content.length()").value(3));
    }

    @Test
    void dataLifecycle() throws Exception {
        createUser("dave");

        mockMvc.perform(put("/data/dave/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"threshold\": 3, \"tags\": [\"x\", \"y\"]}"))
                .andExpect(status().isOk());
        mockMvc.perform(put("/data/dave/name")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("\"dave\""))
                .andExpect(status().isOk());

        mockMvc.perform(get("/data/dave/keys"))
                .andExpect(jsonPath("$.content[0]").value("settings"))
                .andExpect(jsonPath("$.content[1]").value("name"));
        mockMvc.perform(get("/data/dave/settings"))
                .andExpect(jsonPath("$.content.threshold").value(3))
                .andExpect(jsonPath("$.content.tags[1]").value("y"));

        mockMvc.perform(delete("/data/dave/name")).andExpect(status().isOk());
        mockMvc.perform(delete("/data/dave/name")).andExpect(status().isNotFound());
        mockMvc.perform(get("/data/dave/name")).andExpect(status().isNotFound());
        mockMvc.perform(put("/data/dave/broken")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{oops"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void configCanBeReadAndIsSavedToTheFile() throws Exception {
        createUser("frank");
        addJob("frank", job("f", YEARLY, false)).andExpect(status().isCreated());
        mockMvc.perform(put("/data/frank/k").contentType(MediaType.APPLICATION_JSON).content("1"));

        mockMvc.perform(get(ADMIN + "/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content.frank.cron[0].id").value("f"))
                .andExpect(jsonPath("$.content.frank.data.k").value(1));

        dataCronAdminConfig.getDataCronScheduler().save();
        String file = new String(Files.readAllBytes(CONFIG_DIR.resolve("config.json")), StandardCharsets.UTF_8);
        assertThat(file).contains("\"frank\"").contains("\"" + YEARLY + "\"");

        mockMvc.perform(get(ADMIN + "/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").value("Configuration reloaded from " + CONFIG_DIR.resolve("config.json")));
        mockMvc.perform(get("/cron/frank/job/f")).andExpect(status().isOk());
    }

    @Test
    void replacingTheConfigValidatesEveryJob() throws Exception {
        mockMvc.perform(put(ADMIN + "/config")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"x\": {\"cron\": [" + job("j", "0 0 99 * * *", true) + "], \"data\": {}}}"))
                .andExpect(status().isBadRequest());
    }
}
