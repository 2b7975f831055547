package io.cronkeeper.core.runner.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cronkeeper.core.account.ConfiguredAccountResolver;
import io.cronkeeper.core.job.Job;
import io.cronkeeper.core.job.JobPayload;
import io.cronkeeper.core.job.JobRequest;
import io.cronkeeper.core.job.JobStatus;
import io.cronkeeper.core.job.JobType;
import io.cronkeeper.core.runner.ActionContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CurlJobActionTest {
    @TempDir
    Path tempDir;

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldCallUrlAndLogStatus() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("pong"));
        ActionContext context = context(server.url("/health").toString());

        new CurlJobAction().invoke(context);

        assertThat(server.takeRequest().getPath()).isEqualTo("/health");
        assertThat(Files.readString(context.logFile())).contains("HTTP 200");
    }

    @Test
    void errorStatusShouldFail() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> new CurlJobAction().invoke(context(server.url("/health").toString())))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("HTTP 503");
    }

    private ActionContext context(String url) {
        JobPayload payload = new JobPayload(null, null, null, null, null, url, null, null, null);
        Job job = Job.from(JobRequest.builder("ping", JobType.CURL, "@every 1m").payload(payload).build(),
            JobStatus.ENABLE, Instant.EPOCH).withId(1);
        return new ActionContext(job, 1, Duration.ofSeconds(5), Instant.EPOCH, tempDir.resolve("run.log"),
            tempDir.resolve("task"), List.of(), new ConfiguredAccountResolver(List.of()));
    }
}
