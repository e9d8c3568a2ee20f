package me.golemcore.reminder.adapter.outbound.voice;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.reminder.infrastructure.config.BotProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ElevenLabsSpeechAdapterTest {

    private MockWebServer mockServer;
    private ElevenLabsSpeechAdapter adapter;
    private BotProperties properties;
    private PcmAudioPlayer audioPlayer;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(5, TimeUnit.SECONDS)
                .build();

        properties = new BotProperties();
        properties.getVoice().setEnabled(true);
        properties.getVoice().setApiKey("test-api-key");
        properties.getVoice().setVoiceId("test-voice-id");
        audioPlayer = mock(PcmAudioPlayer.class);

        adapter = new TestableElevenLabsSpeechAdapter(client, properties, new ObjectMapper(), audioPlayer,
                mockServer.url("/").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void speakShouldSynthesizeAndPlayPcm() throws Exception {
        byte[] pcm = new byte[] { 1, 2, 3, 4 };
        mockServer.enqueue(new MockResponse()
                .setBody(new okio.Buffer().write(pcm))
                .addHeader("Content-Type", "audio/pcm"));

        adapter.speak("Reminder: call mom").get(5, TimeUnit.SECONDS);

        verify(audioPlayer).play(pcm, 22050);
        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("test-api-key", request.getHeader("xi-api-key"));
        assertTrue(request.getPath().contains("test-voice-id"));
        assertTrue(request.getPath().contains("output_format=pcm_22050"));
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"text\":\"Reminder: call mom\""));
        assertTrue(body.contains("\"model_id\":\"eleven_multilingual_v2\""));
    }

    @Test
    void synthesizeShouldRetryTransientErrors() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        mockServer.enqueue(new MockResponse().setBody(new okio.Buffer().write(new byte[] { 7 })));

        byte[] result = adapter.synthesize("Test");

        assertArrayEquals(new byte[] { 7 }, result);
        assertEquals(2, mockServer.getRequestCount());
    }

    @Test
    void synthesizeShouldGiveUpAfterMaxAttempts() {
        for (int i = 0; i < 3; i++) {
            mockServer.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        }

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> adapter.synthesize("Test"));

        assertTrue(ex.getMessage().contains("HTTP 429"));
        assertEquals(3, mockServer.getRequestCount());
    }

    @Test
    void synthesizeShouldNotRetryAuthErrors() {
        mockServer.enqueue(new MockResponse().setResponseCode(401)
                .setBody("{\"detail\":{\"status\":\"invalid_api_key\",\"message\":\"Invalid API key\"}}"));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> adapter.synthesize("Test"));

        assertEquals("ElevenLabs TTS error (HTTP 401): Invalid API key", ex.getMessage());
        assertEquals(1, mockServer.getRequestCount());
    }

    @Test
    void speakShouldFailWithoutApiKey() {
        properties.getVoice().setApiKey("");

        var future = adapter.speak("Test");
        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, ex.getCause());
        verify(audioPlayer, never()).play(any(), anyInt());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void shouldReportAvailability() {
        assertTrue(adapter.isAvailable());

        properties.getVoice().setApiKey(" ");
        assertFalse(adapter.isAvailable());

        properties.getVoice().setApiKey("key");
        properties.getVoice().setEnabled(false);
        assertFalse(adapter.isAvailable());
    }

    private static class TestableElevenLabsSpeechAdapter extends ElevenLabsSpeechAdapter {
        private final String baseUrl;

        TestableElevenLabsSpeechAdapter(OkHttpClient client, BotProperties properties, ObjectMapper objectMapper,
                PcmAudioPlayer audioPlayer, String baseUrl) {
            super(client, properties, objectMapper, audioPlayer);
            this.baseUrl = baseUrl;
        }

        @Override
        protected String getTtsUrl(String voiceId) {
            return baseUrl + "v1/text-to-speech/" + voiceId;
        }

        @Override
        protected long retryBackoffMillis(int attempt) {
            return 0;
        }
    }
}
