package com.jewelrec.main.controller;

import com.jewelrec.common.exception.InvalidQueryException;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.common.model.InteractionType;
import com.jewelrec.main.dto.InteractionRequest;
import com.jewelrec.main.dto.PreferencesRequest;
import com.jewelrec.main.service.UserProfileService;
import com.jewelrec.main.service.UserSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Tag(name = "Users", description = "User preferences and interaction history")
public class UserController {

    private final UserProfileService userProfileService;

    @PostMapping("/{userId}/preferences")
    @Operation(summary = "Update preferences",
               description = "Replace the explicit preferences of a user; creates the profile if needed")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Preferences stored"),
        @ApiResponse(responseCode = "503", description = "Embedding service unavailable")
    })
    public ResponseEntity<UserSummary> updatePreferences(
            @PathVariable String userId,
            @Valid @RequestBody PreferencesRequest request) {
        log.info("Received preferences update: user={}", userId);
        return ResponseEntity.ok(userProfileService.updatePreferences(userId, request.toPreferenceMap()));
    }

    @PostMapping("/{userId}/interactions")
    @Operation(summary = "Log an interaction",
               description = "Record a click, like or purchase by item embedding or by dataset item reference")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Interaction logged"),
        @ApiResponse(responseCode = "400", description = "Missing item or invalid interaction type"),
        @ApiResponse(responseCode = "404", description = "Referenced item not found")
    })
    public ResponseEntity<UserSummary> logInteraction(
            @PathVariable String userId,
            @Valid @RequestBody InteractionRequest request) {
        log.info("Received interaction: user={}, type={}, dataset={}, item={}",
                userId, request.getInteractionType(), request.getDataset(), request.getItemId());

        InteractionType type = InteractionType.fromKey(request.getInteractionType());
        UserSummary summary;
        if (request.getItemEmbedding() != null && request.getItemEmbedding().length > 0) {
            String itemKey = request.getDataset() != null && request.getItemId() != null
                ? Dataset.fromKey(request.getDataset()).qualify(request.getItemId())
                : null;
            summary = userProfileService.logInteraction(userId, request.getItemEmbedding(), type,
                request.getWeight(), request.getTimestamp(), itemKey);
        } else if (request.getDataset() != null && request.getItemId() != null) {
            summary = userProfileService.logItemInteraction(userId, Dataset.fromKey(request.getDataset()),
                request.getItemId(), type, request.getWeight(), request.getTimestamp());
        } else {
            throw new InvalidQueryException("Interaction needs item_embedding or dataset with item_id");
        }
        return ResponseEntity.ok(summary);
    }

    @GetMapping("/{userId}")
    @Operation(summary = "Get profile summary",
               description = "Preference text, interaction counts and cold-start status of a user")
    @ApiResponse(responseCode = "200", description = "Summary returned; exists=false for unknown users")
    public ResponseEntity<UserSummary> getProfile(@PathVariable String userId) {
        log.debug("Profile summary requested: user={}", userId);
        return ResponseEntity.ok(userProfileService.summary(userId));
    }

    @PostMapping("/{userId}/initialize")
    @Operation(summary = "Initialize from similar users",
               description = "Seed a cold user's preference vector from the most similar users")
    @ApiResponse(responseCode = "200", description = "Initialization attempted")
    public ResponseEntity<Map<String, Object>> initialize(@PathVariable String userId) {
        log.info("Received initialization request: user={}", userId);
        boolean initialized = userProfileService.initializeFromSimilarUsers(userId);
        return ResponseEntity.ok(Map.of("user_id", userId, "initialized", initialized));
    }
}
