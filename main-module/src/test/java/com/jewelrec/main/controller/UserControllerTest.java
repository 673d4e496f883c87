package com.jewelrec.main.controller;

import com.jewelrec.common.exception.ItemNotFoundException;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.common.model.InteractionType;
import com.jewelrec.main.exception.GlobalExceptionHandler;
import com.jewelrec.main.service.UserProfileService;
import com.jewelrec.main.service.UserSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class UserControllerTest {

    @Mock
    private UserProfileService userProfileService;

    private MockMvc mockMvc;

    private final UserSummary summary = new UserSummary("u1", true, null, true, 1,
        Map.of(InteractionType.LIKE, 1L), null, true);

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new UserController(userProfileService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void updatesPreferences() throws Exception {
        when(userProfileService.updatePreferences(eq("u1"), any())).thenReturn(summary);

        mockMvc.perform(post("/api/users/u1/preferences")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"metal\": \"rose gold\", \"price_range\": [1000, 5000]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.user_id").value("u1"));

        verify(userProfileService).updatePreferences("u1", Map.of("metal", "rose gold", "price_range", List.of(1000.0, 5000.0)));
    }

    @Test
    void logsInteractionByEmbedding() throws Exception {
        when(userProfileService.logInteraction(eq("u1"), any(float[].class), eq(InteractionType.LIKE),
            isNull(), isNull(), eq("diamonds:7"))).thenReturn(summary);

        mockMvc.perform(post("/api/users/u1/interactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"interaction_type\": \"like\", \"item_embedding\": [1, 0],"
                    + " \"dataset\": \"diamonds\", \"item_id\": \"7\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.interaction_count").value(1));
    }

    @Test
    void logsInteractionByItemReference() throws Exception {
        when(userProfileService.logItemInteraction("u1", Dataset.SETTINGS, "42", InteractionType.PURCHASE, null, null))
            .thenReturn(summary);

        mockMvc.perform(post("/api/users/u1/interactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"interaction_type\": \"purchase\", \"dataset\": \"settings\", \"item_id\": \"42\"}"))
            .andExpect(status().isOk());
    }

    @Test
    void unknownItemIsNotFound() throws Exception {
        when(userProfileService.logItemInteraction("u1", Dataset.DIAMONDS, "404", InteractionType.CLICK, null, null))
            .thenThrow(new ItemNotFoundException("Item 404 not found in diamonds"));

        mockMvc.perform(post("/api/users/u1/interactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"interaction_type\": \"click\", \"dataset\": \"diamonds\", \"item_id\": \"404\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void interactionWithoutItemIsRejected() throws Exception {
        mockMvc.perform(post("/api/users/u1/interactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"interaction_type\": \"click\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(userProfileService);
    }

    @Test
    void unknownInteractionTypeIsRejected() throws Exception {
        mockMvc.perform(post("/api/users/u1/interactions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"interaction_type\": \"wishlist\", \"item_embedding\": [1, 0]}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void returnsSummary() throws Exception {
        when(userProfileService.summary("u1")).thenReturn(summary);

        mockMvc.perform(get("/api/users/u1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sparse").value(true))
            .andExpect(jsonPath("$.has_vector").value(true));
    }
}
