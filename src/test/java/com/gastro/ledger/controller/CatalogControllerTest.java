package com.gastro.ledger.controller;

import com.gastro.ledger.dto.IngredientResponse;
import com.gastro.ledger.exception.StateException;
import com.gastro.ledger.model.UnitType;
import com.gastro.ledger.service.CatalogService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class CatalogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CatalogService catalogService;

    @Test
    @WithMockUser(roles = "STAFF")
    void listIngredients_openToStaff() throws Exception {
        when(catalogService.listIngredients())
                .thenReturn(List.of(new IngredientResponse(1L, "Kebab meat", UnitType.WEIGHT, "kg", true)));

        mockMvc.perform(get("/api/catalog/ingredients"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].unitType").value("WEIGHT"));
    }

    @Test
    @WithMockUser(roles = "STAFF")
    void createIngredient_forbiddenForStaff() throws Exception {
        mockMvc.perform(post("/api/catalog/ingredients")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Cabbage\",\"unitType\":\"WEIGHT\"}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(catalogService);
    }

    @Test
    @WithMockUser(roles = { "STAFF", "MANAGER" })
    void createIngredient_byManager() throws Exception {
        when(catalogService.createIngredient(any()))
                .thenReturn(new IngredientResponse(6L, "Cabbage", UnitType.WEIGHT, "kg", true));

        mockMvc.perform(post("/api/catalog/ingredients")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Cabbage\",\"unitType\":\"WEIGHT\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.unitLabel").value("kg"));
    }

    @Test
    @WithMockUser(roles = { "STAFF", "MANAGER" })
    void changeUnitType_lockedIsConflict() throws Exception {
        when(catalogService.changeUnitType(2L, UnitType.WEIGHT))
                .thenThrow(new StateException("Unit type of Pita bread cannot change once batches exist",
                        StateException.UNIT_TYPE_LOCKED));

        mockMvc.perform(put("/api/catalog/ingredients/2/unit-type")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"unitType\":\"WEIGHT\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("UNIT_TYPE_LOCKED"));
    }
}
