package io.chimera.core.provider;

import java.io.IOException;
import java.time.Duration;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * OkHttp plumbing shared by the HTTP backed adapters.
 */
public final class ProviderHttp {
    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(90);

    private ProviderHttp() {
    }

    public static OkHttpClient client(Duration callTimeout) {
        Duration timeout = callTimeout == null || callTimeout.isZero() || callTimeout.isNegative()
            ? DEFAULT_TIMEOUT
            : callTimeout;
        return new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(timeout)
            .writeTimeout(Duration.ofSeconds(20))
            .callTimeout(timeout)
            .build();
    }

    /**
     * Body of a successful response, or a {@link ProviderHttpException} for any non-2xx status.
     */
    public static String successBody(Response response) throws IOException {
        ResponseBody body = response.body();
        String text = body == null ? "" : body.string();
        if (!response.isSuccessful()) {
            throw new ProviderHttpException(response.code(), text);
        }
        return text;
    }
}
