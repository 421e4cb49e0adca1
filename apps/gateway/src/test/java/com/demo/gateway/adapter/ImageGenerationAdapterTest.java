package com.demo.gateway.adapter;

import com.demo.gateway.observability.CallOutcome;
import com.demo.gateway.observability.ErrorKind;
import com.demo.gateway.transport.TransportRequest;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Image adapter: Replicate prediction parsing and the tagged placeholder fallback.
 */
class ImageGenerationAdapterTest {

    private static final List<String> IMAGES = List.of("/fallback/language-1.svg", "/fallback/language-2.svg");
    private static final String MODEL = "black-forest-labs/flux-1.1-pro";

    private AdapterFixture fixture;

    @BeforeEach
    void setup() {
        fixture = new AdapterFixture();
    }

    @AfterEach
    void teardown() {
        fixture.close();
    }

    @Test
    void testGenerate_ParsesArrayOutput() throws Exception {
        fixture.transport.respond(201, "{\"status\":\"succeeded\",\"output\":[\"https://cdn.example.test/out-0.webp\"]}");

        CallOutcome<ImageResult> outcome = adapter(true).generateImage(
            new ImageRequest("a lighthouse", null, null, "artistic", null)).join();

        assertTrue(outcome.success());
        assertFalse(outcome.fallback());
        assertEquals("https://cdn.example.test/out-0.webp", outcome.data().url());
        assertEquals("a lighthouse", outcome.data().prompt(), "Result carries the caller's prompt, not the enhanced one");

        TransportRequest request = fixture.transport.requests.get(0);
        assertEquals("https://api.example.test/v1/models/" + MODEL + "/predictions", request.url());
        JsonNode input = fixture.objectMapper.readTree(request.body()).path("input");
        assertTrue(input.path("prompt").asText().startsWith("a lighthouse, high quality"));
        assertTrue(input.path("prompt").asText().endsWith("vibrant colors"));
        assertEquals(512, input.path("width").asInt());
    }

    @Test
    void testGenerate_StringOutputAndNoEnhancement() throws Exception {
        fixture.transport.respond(200, "{\"output\":\"https://cdn.example.test/single.png\"}");

        CallOutcome<ImageResult> outcome = adapter(true).generateImage(
            new ImageRequest("raw prompt", 768, 256, null, false)).join();

        assertEquals("https://cdn.example.test/single.png", outcome.data().url());
        JsonNode input = fixture.objectMapper.readTree(fixture.transport.requests.get(0).body()).path("input");
        assertEquals("raw prompt", input.path("prompt").asText());
        assertEquals(768, input.path("width").asInt());
        assertEquals(256, input.path("height").asInt());
    }

    @Test
    void testExhaustedRetries_TaggedFallback() {
        fixture.transport.respond(503, "");

        CallOutcome<ImageResult> outcome = adapter(true).generateImage(
            new ImageRequest("a lighthouse", null, null, null, null)).join();

        assertEquals(3, fixture.transport.calls());
        assertTrue(outcome.success());
        assertTrue(outcome.fallback(), "Substituted payload must be tagged");
        assertEquals(ErrorKind.SERVICE_UNAVAILABLE, outcome.errorKind(), "Cause of the substitution is kept");
        assertEquals("fallback", outcome.data().model());
        assertTrue(IMAGES.contains(outcome.data().url()));
    }

    @Test
    void testFallback_DeterministicPerPrompt() {
        ImageGenerationAdapter adapter = adapter(true);

        String first = adapter.fallbackImage("a lighthouse").url();
        String second = adapter.fallbackImage("a lighthouse").url();

        assertEquals(first, second);
        assertEquals(IMAGES.get(Math.floorMod("a lighthouse".hashCode(), IMAGES.size())), first);
    }

    @Test
    void testFallback_PlaceholderWithoutImages() {
        ImageGenerationAdapter adapter = new ImageGenerationAdapter(AdapterFixture.config("token", true),
            fixture.transport, fixture.clientFactory, fixture.objectMapper, MODEL, List.of(),
            "/fallback/image-placeholder.svg");

        assertEquals("/fallback/image-placeholder.svg", adapter.fallbackImage("anything").url());
    }

    @Test
    void testOpenCircuit_TaggedFallback() {
        fixture.transport.respond(500, "");
        ImageGenerationAdapter adapter = adapter(true);
        for (int i = 0; i < 3; i++) {
            CallOutcome<ImageResult> terminal = adapter.generateImage(new ImageRequest("p", null, null, null, null)).join();
            assertFalse(terminal.success(), "500 is terminal and not exhausted, so no fallback");
        }
        int before = fixture.transport.calls();

        CallOutcome<ImageResult> outcome = adapter.generateImage(new ImageRequest("p", null, null, null, null)).join();

        assertEquals(before, fixture.transport.calls());
        assertTrue(outcome.fallback());
        assertEquals(ErrorKind.CIRCUIT_OPEN, outcome.errorKind());
    }

    @Test
    void testBadRequest_NoFallback() {
        fixture.transport.respond(400, "{\"detail\":\"invalid size\"}");

        CallOutcome<ImageResult> outcome = adapter(true).generateImage(
            new ImageRequest("p", 1, 1, null, null)).join();

        assertFalse(outcome.success());
        assertEquals(ErrorKind.BAD_REQUEST, outcome.errorKind());
        assertEquals(1, fixture.transport.calls());
    }

    @Test
    void testFallbackDisabled_Failure() {
        fixture.transport.respond(503, "");

        CallOutcome<ImageResult> outcome = adapter(false).generateImage(
            new ImageRequest("p", null, null, null, null)).join();

        assertFalse(outcome.success());
        assertFalse(outcome.fallback());
    }

    @Test
    void testMissingToken_NoFallback() {
        ImageGenerationAdapter adapter = new ImageGenerationAdapter(AdapterFixture.config(null, true),
            fixture.transport, fixture.clientFactory, fixture.objectMapper, MODEL, IMAGES, "/placeholder.svg");

        CallOutcome<ImageResult> outcome = adapter.generateImage(new ImageRequest("p", null, null, null, null)).join();

        assertFalse(outcome.success(), "A configuration problem is reported, not hidden behind a placeholder");
        assertEquals(ErrorKind.UNAUTHORIZED, outcome.errorKind());
    }

    @Test
    void testEnhancePrompt_UnknownStyleUsesMinimalist() {
        assertEquals(ImageGenerationAdapter.enhancePrompt("x", "minimalist"),
            ImageGenerationAdapter.enhancePrompt("x", "baroque"));
        assertEquals(ImageGenerationAdapter.enhancePrompt("x", "minimalist"),
            ImageGenerationAdapter.enhancePrompt("x", null));
    }

    private ImageGenerationAdapter adapter(boolean fallbackEnabled) {
        return new ImageGenerationAdapter(AdapterFixture.config("token", fallbackEnabled), fixture.transport,
            fixture.clientFactory, fixture.objectMapper, MODEL, IMAGES, "/fallback/image-placeholder.svg");
    }
}
