package com.flagship.invoice_ocr.currency;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CurrencyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Currency lookup is case-insensitive and reports minor units")
    void testGetCurrency() throws Exception {
        mockMvc.perform(get("/api/currencies/jpy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("JPY"))
                .andExpect(jsonPath("$.minor_units").value(0));

        mockMvc.perform(get("/api/currencies/KWD"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.minor_units").value(3));
    }

    @Test
    @DisplayName("Unknown currency is a 404")
    void testUnknownCurrency() throws Exception {
        mockMvc.perform(get("/api/currencies/XYZ"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Unknown Currency"))
                .andExpect(jsonPath("$.correlation_id").exists());
    }

    @Test
    @DisplayName("Detection lists currencies in order of appearance")
    void testDetect() throws Exception {
        mockMvc.perform(post("/api/currencies/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Total 100 EUR, paid in USD\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currencies", contains("EUR", "USD")));
    }

    @Test
    @DisplayName("Health endpoint reports UP")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.currencies").isNumber());
    }
}
