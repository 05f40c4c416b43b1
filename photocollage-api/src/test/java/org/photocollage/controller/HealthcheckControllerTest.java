package org.photocollage.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = HealthcheckController.class)
@TestPropertySource(properties = {"app.version=1.0.0"})
class HealthcheckControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void getPing_ShouldReturnHealthcheckResponse() throws Exception {
        mockMvc.perform(get("/api/v1/healthcheck"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.message").value("Collage renderer is running."))
                .andExpect(jsonPath("$.timestamp").exists())
                .andExpect(jsonPath("$.version").value("1.0.0"));
    }
}
