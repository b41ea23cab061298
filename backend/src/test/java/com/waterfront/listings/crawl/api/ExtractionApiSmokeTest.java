package com.waterfront.listings.crawl.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ExtractionApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void runEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/extraction/run"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void unknownRunIdIsNotFound() throws Exception {
        mockMvc.perform(get("/api/extraction/00000000-0000-0000-0000-000000000000"))
            .andExpect(status().isNotFound());
    }

    @Test
    void runWithoutTargetsIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/extraction/run").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void listingCountsAreReported() throws Exception {
        mockMvc.perform(get("/api/listings/count"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.listings").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.waterfront").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.runActive").value(false));
    }
}
