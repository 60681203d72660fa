package com.bsl.dimrank.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class RankControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void healthReturnsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void rankDetectsProfileAndOrdersChunks() throws Exception {
        String body = "{"
            + "\"query\":\"contract liability compliance export regulation court precedent\","
            + "\"result_count\":3"
            + "}";

        mockMvc.perform(post("/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-trace-id", "trace-1")
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.profile_used").value("legal"))
            .andExpect(jsonPath("$.results.length()").value(3))
            .andExpect(jsonPath("$.results[0].chunk_id").value("chunk-003"))
            .andExpect(jsonPath("$.results[0].rank").value(1))
            .andExpect(jsonPath("$.trace_id").value("trace-1"))
            .andExpect(jsonPath("$.request_id").isNotEmpty())
            .andExpect(jsonPath("$.reason_codes").isArray());
    }

    @Test
    void rankHonorsProfileOverrideAndReportsFilters() throws Exception {
        String body = "{"
            + "\"query\":\"simple guide to search relevance\","
            + "\"result_count\":2,"
            + "\"profile\":\"business\""
            + "}";

        mockMvc.perform(post("/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.profile_used").value("business"))
            .andExpect(jsonPath("$.results.length()").value(2))
            .andExpect(jsonPath("$.constraints[0].phrase").value("simple"))
            .andExpect(jsonPath("$.constraints[0].targets[0].dimension").value("complexity"))
            .andExpect(jsonPath("$.constraints[0].targets[0].level").value("low"));
    }

    @Test
    void rankRejectsMissingQuery() throws Exception {
        mockMvc.perform(post("/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.trace_id").isNotEmpty())
            .andExpect(jsonPath("$.request_id").isNotEmpty());
    }

    @Test
    void rankRejectsOutOfRangeResultCount() throws Exception {
        mockMvc.perform(post("/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"market growth\",\"result_count\":1000}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void rankRejectsMalformedBody() throws Exception {
        mockMvc.perform(post("/rank")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void profilesListsConfiguredProfiles() throws Exception {
        mockMvc.perform(get("/profiles"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.default_profile").value("general"))
            .andExpect(jsonPath("$.profiles.length()").value(4))
            .andExpect(jsonPath("$.profiles[0].id").value("general"))
            .andExpect(jsonPath("$.profiles[0].is_default").value(true))
            .andExpect(jsonPath("$.profiles[1].dimensions.novelty").value(1.5));
    }

    @Test
    void reloadReturnsActiveProfiles() throws Exception {
        mockMvc.perform(post("/profiles/reload"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.profiles.length()").value(4));
    }
}
