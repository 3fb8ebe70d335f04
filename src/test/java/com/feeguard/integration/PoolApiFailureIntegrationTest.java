package com.feeguard.integration;

import com.feeguard.pool.PoolStateStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Error bodies when the backing store is unavailable or the request cannot be bound.
 */
@SpringBootTest
@AutoConfigureMockMvc
class PoolApiFailureIntegrationTest {

    @Autowired MockMvc mvc;

    @MockBean PoolStateStore store;

    @Test
    void storeFailure_isInternalErrorWithoutDetails() throws Exception {
        when(store.findConfig(any())).thenThrow(new IllegalStateException("connection refused"));

        mvc.perform(get("/v1/pools/{poolId}", "eth-usdc"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error_code").value("INTERNAL_ERROR"))
            .andExpect(jsonPath("$.message").value("fee engine failed to serve the request"))
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void nonNumericTradeSize_isBadRequest() throws Exception {
        mvc.perform(post("/v1/pools/{poolId}/quote", "eth-usdc")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"current_metric\": 7, \"trade_size\": \"lots\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
    }
}
