package com.narrateplus.tts;

import com.narrateplus.generation.PermanentGenerationException;
import com.narrateplus.generation.TransientGenerationException;
import com.narrateplus.model.EngineKind;
import com.narrateplus.model.TierConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Bridge mode: POST text to a locally running synthesis service and read WAV bytes back.
 *
 * The bridge owns the actual voices (system, Kokoro, Piper):
 * - GET  /health
 * - POST /synthesize {"text":"...","engine":"KOKORO","voice":"af_heart","quantization":"Q8","device":"CPU"}
 */
@Slf4j
public final class BridgeSpeechEngine implements SpeechEngine
{
    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final String baseUrl;
    private final OkHttpClient http;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Set<Call> inFlight = ConcurrentHashMap.newKeySet();

    public BridgeSpeechEngine(OkHttpClient http, String baseUrl, int timeoutMs)
    {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.http = http.newBuilder()
                .callTimeout(Math.max(100, timeoutMs), TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public boolean isAvailable()
    {
        // No health check here to keep it cheap; callers can probe with checkHealth().
        return !closed.get();
    }

    @Override
    public Set<EngineKind> supportedEngines()
    {
        return EnumSet.allOf(EngineKind.class);
    }

    /**
     * Blocking health probe.
     *
     * @return null when the bridge answered 2xx, otherwise a description of the problem
     */
    public String checkHealth()
    {
        Request request = new Request.Builder().url(baseUrl + "/health").get().build();

        try (Response resp = http.newCall(request).execute())
        {
            return resp.isSuccessful() ? null : "Health check failed: HTTP " + resp.code();
        }
        catch (IOException e)
        {
            return "Bridge not reachable: " + e.getClass().getSimpleName() + " " + safeTrim(e.getMessage());
        }
    }

    @Override
    public CompletableFuture<byte[]> synthesize(String text, TierConfig tier)
    {
        if (closed.get())
        {
            return CompletableFuture.failedFuture(new TransientGenerationException("Speech engine shut down"));
        }
        if (text == null || text.trim().isEmpty())
        {
            return CompletableFuture.failedFuture(new PermanentGenerationException("Nothing to synthesize"));
        }

        String payload = SimpleJson.object(
                "text", text.trim(),
                "engine", tier.getEngine().name(),
                "voice", tier.getVoice(),
                "quantization", tier.getQuantization() == null ? null : tier.getQuantization().name(),
                "device", tier.getDevice() == null ? null : tier.getDevice().name());

        Request request = new Request.Builder()
                .url(baseUrl + "/synthesize")
                .post(RequestBody.create(payload, JSON))
                .build();

        CompletableFuture<byte[]> result = new CompletableFuture<>();
        Call call = http.newCall(request);
        inFlight.add(call);

        call.enqueue(new Callback()
        {
            @Override
            public void onFailure(Call c, IOException e)
            {
                inFlight.remove(c);
                if (closed.get() || c.isCanceled())
                {
                    result.completeExceptionally(new TransientGenerationException("Speech engine shut down", e));
                    return;
                }
                result.completeExceptionally(new TransientGenerationException(
                        "Bridge IO exception: " + e.getClass().getSimpleName() + " " + safeTrim(e.getMessage()), e));
            }

            @Override
            public void onResponse(Call c, Response resp)
            {
                inFlight.remove(c);
                try (Response r = resp)
                {
                    ResponseBody body = r.body();
                    byte[] bytes = body == null ? new byte[0] : body.bytes();

                    if (r.isSuccessful())
                    {
                        if (bytes.length == 0)
                        {
                            result.completeExceptionally(new TransientGenerationException("Bridge returned no audio"));
                        }
                        else
                        {
                            result.complete(bytes);
                        }
                        return;
                    }

                    result.completeExceptionally(toFailure(r.code(), new String(bytes, StandardCharsets.UTF_8)));
                }
                catch (IOException e)
                {
                    result.completeExceptionally(new TransientGenerationException("Bridge response read failed", e));
                }
            }
        });

        // Failed from outside (timeout, cancel): stop the HTTP call too.
        result.whenComplete((bytes, err) ->
        {
            if (err != null && inFlight.remove(call))
            {
                call.cancel();
            }
        });
        return result;
    }

    int inFlightCount()
    {
        return inFlight.size();
    }

    @Override
    public void shutdown()
    {
        if (!closed.compareAndSet(false, true))
        {
            return;
        }

        for (Call c : inFlight)
        {
            c.cancel();
        }
        inFlight.clear();
    }

    static RuntimeException toFailure(int code, String body)
    {
        String detail = SimpleJson.extractString(body, "error");
        String msg = "Synthesize failed: HTTP " + code + (detail == null ? "" : " " + detail);

        if (code == 408 || code == 429 || code >= 500)
        {
            return new TransientGenerationException(msg);
        }
        return new PermanentGenerationException(msg);
    }

    private static String safeTrim(String s)
    {
        return s == null ? "" : s.trim();
    }
}
