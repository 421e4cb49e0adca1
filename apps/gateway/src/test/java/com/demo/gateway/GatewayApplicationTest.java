package com.demo.gateway;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full context with no credentials configured: every provider is wired, and
 * calls fail fast without leaving the process.
 */
@SpringBootTest(properties = {
    "gateway.providers.image.credential=",
    "gateway.providers.perplexity.credential=",
    "gateway.providers.grok.credential=",
    "gateway.providers.anthropic.credential="
})
@AutoConfigureMockMvc
class GatewayApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testCircuits_OnePerProvider() throws Exception {
        mockMvc.perform(get("/api/circuits"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].name", containsInAnyOrder("anthropic", "grok", "image", "perplexity")))
            .andExpect(jsonPath("$[0].state").value("CLOSED"));
    }

    @Test
    void testUnknownCircuit_NotFound() throws Exception {
        mockMvc.perform(post("/api/circuits/openai/reset"))
            .andExpect(status().isNotFound());
    }

    @Test
    void testQueryWithoutCredential_Unauthorized() throws Exception {
        MvcResult pending = mockMvc.perform(post("/api/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"What is serendipity?\"}"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(pending))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error.kind").value("UNAUTHORIZED"))
            .andExpect(jsonPath("$.error.httpStatus").value(401));
    }

    @Test
    void testBlankWord_BadRequest() throws Exception {
        mockMvc.perform(post("/api/suggestions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"word\":\" \"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testHealth_Exposed() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.components.circuitBreakers.details.grok").value("CLOSED"));
    }
}
