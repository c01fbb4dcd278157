package com.pitchscope.service.stt.provider;

import com.pitchscope.config.properties.ProviderProperties;
import com.pitchscope.domain.AudioConfiguration;
import com.pitchscope.domain.ProviderSession;
import com.pitchscope.exception.ConnectionException;
import com.pitchscope.exception.ProtocolException;
import com.pitchscope.util.LogSanitizer;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.util.Objects;
import java.util.Set;

/**
 * {@link SttProviderClient} for the Gladia v2 API, using OkHttp and org.json.
 *
 * <p>All requests carry the {@code X-Gladia-Key} header. Timeouts come from the injected
 * {@link OkHttpClient} (connect timeout and per-call timeout).
 */
public class GladiaProviderClient implements SttProviderClient {

    private static final Logger LOG = LogManager.getLogger(GladiaProviderClient.class);

    static final String API_KEY_HEADER = "X-Gladia-Key";
    static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final MediaType AUDIO_WAV = MediaType.get("audio/wav");

    private static final Set<String> AUDIO_SHAPE_KEYS = Set.of("encoding", "sample_rate", "bit_depth", "channels");

    private final OkHttpClient httpClient;
    private final ProviderProperties properties;

    public GladiaProviderClient(OkHttpClient httpClient, ProviderProperties properties) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public ProviderSession createLiveSession(AudioConfiguration configuration) {
        String url = endpoint(properties.getLivePath());
        Request request = authorized(url)
                .post(RequestBody.create(configuration.toProviderConfig(false).toString(), JSON))
                .build();
        JSONObject body = execute(request, "create live session");
        String id = required(body, "id", url);
        String socketUrl = required(body, "url", url);
        LOG.info("Provider live session created: id={}", id);
        return new ProviderSession(id, socketUrl);
    }

    @Override
    public String uploadAudio(byte[] audio, String fileName) {
        String url = endpoint(properties.getUploadPath());
        RequestBody multipart = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("audio", fileName, RequestBody.create(audio, AUDIO_WAV))
                .build();
        Request request = authorized(url).post(multipart).build();
        JSONObject body = execute(request, "upload audio");
        String audioUrl = required(body, "audio_url", url);
        LOG.debug("Uploaded {} bytes as {}", audio.length, fileName);
        return audioUrl;
    }

    @Override
    public SubmittedJob submitJob(String audioUrl, AudioConfiguration configuration, String language) {
        String url = endpoint(properties.getPreRecordedPath());
        JSONObject payload = new JSONObject();
        payload.put("audio_url", audioUrl);
        if (language != null && !language.isBlank()) {
            payload.put("language", language);
        }
        JSONObject features = configuration.toProviderConfig(true);
        for (String key : features.keySet()) {
            if (!AUDIO_SHAPE_KEYS.contains(key)) {
                payload.put(key, features.get(key));
            }
        }

        Request request = authorized(url)
                .post(RequestBody.create(payload.toString(), JSON))
                .build();
        JSONObject body = execute(request, "submit job");
        SubmittedJob job = new SubmittedJob(required(body, "id", url), required(body, "result_url", url));
        LOG.info("Batch job submitted: id={}", job.id());
        return job;
    }

    @Override
    public JobStatus fetchJob(SubmittedJob job) {
        Request request = authorized(job.resultUrl()).get().build();
        JSONObject body = execute(request, "fetch job");
        JobStatus.State state = JobStatus.State.fromWire(body.optString("status", null));
        switch (state) {
            case DONE:
                return JobStatus.done(BatchResultParser.parse(body));
            case ERROR:
                String reason = body.optString("error_message",
                        body.has("error_code") ? "error_code " + body.opt("error_code") : "unknown error");
                return JobStatus.failed(reason);
            default:
                return JobStatus.pending(state);
        }
    }

    @Override
    public void deleteJob(SubmittedJob job) {
        String url = endpoint(properties.getPreRecordedPath()) + "/" + job.id();
        Request request = authorized(url).delete().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() && response.code() != 404) {
                throw new ConnectionException("Delete job failed with HTTP " + response.code(), url);
            }
        } catch (IOException e) {
            throw new ConnectionException("Delete job failed", url, e);
        }
    }

    private JSONObject execute(Request request, String operation) {
        String url = request.url().toString();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw new ConnectionException(operation + " failed with HTTP " + response.code()
                        + ": " + LogSanitizer.preview(text, 200), url);
            }
            try {
                return new JSONObject(text);
            } catch (JSONException e) {
                throw new ProtocolException(operation + " returned a non-JSON body", e);
            }
        } catch (IOException e) {
            throw new ConnectionException(operation + " failed", url, e);
        }
    }

    private Request.Builder authorized(String url) {
        Request.Builder builder;
        try {
            builder = new Request.Builder().url(url);
        } catch (IllegalArgumentException e) {
            throw new ConnectionException("Invalid provider URL", url, e);
        }
        return builder.header(API_KEY_HEADER, properties.getApiKey() == null ? "" : properties.getApiKey());
    }

    private String endpoint(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private static String required(JSONObject body, String field, String url) {
        String value = body.optString(field, "");
        if (value.isBlank()) {
            throw new ProtocolException("Provider response from " + url + " is missing '" + field + "'");
        }
        return value;
    }
}
