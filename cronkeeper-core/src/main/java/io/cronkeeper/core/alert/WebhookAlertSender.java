package io.cronkeeper.core.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public final class WebhookAlertSender implements AlertSender {
    public static final String METHOD = "webhook";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final HttpUrl url;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public WebhookAlertSender(String url, Duration timeout) {
        this.url = HttpUrl.get(Objects.requireNonNull(url, "url must not be null"));
        this.client = new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .build();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public void send(AlertMessage message) throws IOException {
        RequestBody body = RequestBody.create(mapper.writeValueAsString(message), JSON);
        Request request = new Request.Builder()
            .url(url)
            .post(body)
            .header("content-type", "application/json")
            .build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                String errorBody = response.body() == null ? "" : response.body().string();
                throw new IOException("Webhook returned HTTP " + response.code() + " " + errorBody);
            }
        }
    }
}
