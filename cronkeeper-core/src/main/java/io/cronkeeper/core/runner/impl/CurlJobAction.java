package io.cronkeeper.core.runner.impl;

import io.cronkeeper.core.job.JobType;
import io.cronkeeper.core.runner.ActionContext;
import io.cronkeeper.core.runner.ActionResult;
import io.cronkeeper.core.runner.JobAction;
import java.io.IOException;
import java.time.Duration;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

public final class CurlJobAction implements JobAction {
    private final OkHttpClient client;

    public CurlJobAction() {
        this(new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(60))
            .build());
    }

    public CurlJobAction(OkHttpClient client) {
        this.client = client;
    }

    @Override
    public JobType type() {
        return JobType.CURL;
    }

    @Override
    public ActionResult invoke(ActionContext context) throws IOException {
        String url = context.job().payload().url();
        if (url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        OkHttpClient call = context.bounded()
            ? client.newBuilder().callTimeout(context.timeout()).build()
            : client;
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = call.newCall(request).execute()) {
            context.log("GET " + url + " -> HTTP " + response.code());
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " from " + url);
            }
        }
        return ActionResult.empty();
    }
}
