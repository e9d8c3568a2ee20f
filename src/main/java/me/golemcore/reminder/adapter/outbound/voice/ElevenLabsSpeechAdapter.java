package me.golemcore.reminder.adapter.outbound.voice;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.reminder.infrastructure.config.BotProperties;
import me.golemcore.reminder.port.outbound.SpeechPort;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Speaks reminders through the ElevenLabs text-to-speech API.
 *
 * <p>
 * Audio is requested as raw PCM at {@code bot.voice.sample-rate} and played by
 * {@link PcmAudioPlayer}. Rate limits and transient server errors are retried
 * with exponential backoff.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ElevenLabsSpeechAdapter implements SpeechPort {

    private static final String DEFAULT_TTS_URL_TEMPLATE = "https://api.elevenlabs.io/v1/text-to-speech/%s";
    private static final int MAX_ATTEMPTS = 3;

    private static final ExecutorService VOICE_EXECUTOR = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "elevenlabs-speech");
        t.setDaemon(true);
        return t;
    });

    private final OkHttpClient okHttpClient;
    private final BotProperties properties;
    private final ObjectMapper objectMapper;
    private final PcmAudioPlayer audioPlayer;

    @PostConstruct
    void init() {
        BotProperties.VoiceProperties voice = properties.getVoice();
        if (voice.isEnabled() && !hasApiKey(voice)) {
            log.warn("[ElevenLabs] Voice is enabled but no API key is configured, reminders will not be spoken");
        }
        log.info("[ElevenLabs] Speech adapter initialized: enabled={}, apiKeyConfigured={}, voiceId={}, model={}",
                voice.isEnabled(), hasApiKey(voice), voice.getVoiceId(), voice.getTtsModelId());
    }

    @Override
    public boolean isAvailable() {
        BotProperties.VoiceProperties voice = properties.getVoice();
        return voice.isEnabled() && hasApiKey(voice);
    }

    @Override
    public CompletableFuture<Void> speak(String text) {
        return CompletableFuture.runAsync(() -> {
            byte[] pcm = synthesize(text);
            audioPlayer.play(pcm, properties.getVoice().getSampleRate());
        }, VOICE_EXECUTOR);
    }

    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    byte[] synthesize(String text) {
        BotProperties.VoiceProperties voice = properties.getVoice();
        if (!hasApiKey(voice)) {
            throw new IllegalStateException("ElevenLabs API key not configured");
        }

        try {
            String url = getTtsUrl(voice.getVoiceId()) + "?output_format=pcm_" + voice.getSampleRate();
            String jsonBody = objectMapper.writeValueAsString(
                    new TtsRequest(text, voice.getTtsModelId(), voice.getSpeed()));

            Request request = new Request.Builder()
                    .url(url)
                    .header("xi-api-key", voice.getApiKey())
                    .header("Content-Type", "application/json")
                    .post(RequestBody.create(jsonBody, MediaType.parse("application/json")))
                    .build();

            log.debug("[ElevenLabs] TTS request: {} chars, voice={}", text.length(), voice.getVoiceId());
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                long backoffMs;
                try (Response response = okHttpClient.newCall(request).execute()) {
                    ResponseBody body = response.body();
                    if (response.isSuccessful()) {
                        if (body == null) {
                            throw new IllegalStateException("ElevenLabs TTS returned empty body");
                        }
                        byte[] audio = body.bytes();
                        log.info("[ElevenLabs] TTS success: {} chars -> {} bytes PCM", text.length(), audio.length);
                        return audio;
                    }
                    if (!isRetryableError(response.code()) || attempt == MAX_ATTEMPTS) {
                        throw new IllegalStateException(String.format("ElevenLabs TTS error (HTTP %d): %s",
                                response.code(), extractErrorMessage(body)));
                    }
                    backoffMs = retryBackoffMillis(attempt);
                    log.info("[ElevenLabs] TTS retrying after HTTP {} (attempt {}/{}), backoff={}ms",
                            response.code(), attempt, MAX_ATTEMPTS, backoffMs);
                }
                Thread.sleep(backoffMs);
            }
            throw new IllegalStateException("ElevenLabs TTS failed after " + MAX_ATTEMPTS + " attempts");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("ElevenLabs TTS interrupted", e);
        } catch (IOException e) {
            log.error("[ElevenLabs] TTS network error: {}", e.getMessage());
            throw new UncheckedIOException("Synthesis failed: " + e.getMessage(), e);
        }
    }

    protected String getTtsUrl(String voiceId) {
        return String.format(DEFAULT_TTS_URL_TEMPLATE, voiceId);
    }

    protected long retryBackoffMillis(int attempt) {
        return (long) Math.pow(2, attempt) * 1000;
    }

    private boolean hasApiKey(BotProperties.VoiceProperties voice) {
        return voice.getApiKey() != null && !voice.getApiKey().isBlank();
    }

    private boolean isRetryableError(int code) {
        return code == 429 || code == 500 || code == 503 || code == 504;
    }

    private String extractErrorMessage(ResponseBody body) throws IOException {
        String errorBody = body != null ? body.string() : "";
        try {
            ErrorResponse error = objectMapper.readValue(errorBody, ErrorResponse.class);
            if (error.getDetail() != null && error.getDetail().getMessage() != null) {
                return error.getDetail().getMessage();
            }
            if (error.getMessage() != null) {
                return error.getMessage();
            }
        } catch (IOException e) {
            log.debug("[ElevenLabs] Could not parse error response: {}", errorBody);
        }
        return errorBody.isBlank() ? "Unknown error" : errorBody;
    }

    record TtsRequest(
            String text,
            @JsonProperty("model_id") String modelId,
            float speed) {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorResponse {
        private ErrorDetail detail;
        private String message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorDetail {
        private String status;
        private String message;
    }
}
