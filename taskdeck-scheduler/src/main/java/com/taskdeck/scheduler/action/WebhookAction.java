package com.taskdeck.scheduler.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskdeck.scheduler.action.ActionPayload.WebhookPayload;
import com.taskdeck.scheduler.model.ScheduledJob;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POSTs the job to an external URL. Any non-2xx status is a failure.
 */
@Slf4j
public class WebhookAction {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WebhookAction(Duration connectTimeout, Duration readTimeout) {
        this(new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .writeTimeout(readTimeout)
                .build());
    }

    public WebhookAction(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public ActionResult execute(ScheduledJob job, WebhookPayload payload, ActionContext ctx) {
        if (payload.url() == null) {
            return ActionResult.fail("No webhook URL specified");
        }
        HttpUrl url = HttpUrl.parse(payload.url());
        if (url == null) {
            return ActionResult.fail("Invalid webhook URL: " + payload.url());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id", job.getId());
        body.put("job_type", job.getJobType() != null ? job.getJobType().key() : null);
        body.put("title", job.getTitle());
        body.putAll(payload.body());

        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return ActionResult.fail("Webhook body is not serializable: " + e.getMessage());
        }

        Request.Builder request = new Request.Builder()
                .url(url)
                .header("Content-Type", "application/json")
                .header("Idempotency-Key", ctx.executionId())
                .post(RequestBody.create(json, JSON));
        payload.headers().forEach(request::header);

        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                log.warn("Webhook for job {} returned {}", job.getId(), response.code());
                return ActionResult.fail("Webhook returned " + response.code());
            }
            return ActionResult.ok(parseBody(response.body()));
        } catch (IOException e) {
            log.warn("Webhook for job {} failed: {}", job.getId(), e.getMessage());
            return ActionResult.fail("Webhook request failed: " + e.getMessage());
        }
    }

    private Map<String, Object> parseBody(ResponseBody responseBody) {
        if (responseBody == null) {
            return new LinkedHashMap<>();
        }
        try {
            String text = responseBody.string();
            if (text.isBlank()) {
                return new LinkedHashMap<>();
            }
            return objectMapper.readValue(text, new TypeReference<Map<String, Object>>() {
            });
        } catch (IOException e) {
            // best effort: non-JSON or non-object bodies carry no data
            log.debug("Webhook response is not a JSON object: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
