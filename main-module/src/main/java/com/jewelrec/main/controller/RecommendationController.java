package com.jewelrec.main.controller;

import com.jewelrec.common.filter.FilterCriteria;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.main.dto.QueryInfo;
import com.jewelrec.main.dto.RecommendRequest;
import com.jewelrec.main.dto.RecommendResponse;
import com.jewelrec.main.embedding.EmbeddedQuery;
import com.jewelrec.main.embedding.QueryEmbedder;
import com.jewelrec.main.service.RecommendationResult;
import com.jewelrec.main.service.RecommendationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/recommend")
@RequiredArgsConstructor
@Tag(name = "Recommendations", description = "Personalized diamond and setting combinations")
public class RecommendationController {

    private final QueryEmbedder queryEmbedder;
    private final RecommendationService recommendationService;

    @PostMapping
    @Operation(summary = "Recommend combinations",
               description = "Rank compatible diamond and setting pairs for a query, optionally personalized for a user")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Recommendations computed; may be empty with a message"),
        @ApiResponse(responseCode = "400", description = "Invalid query or filter"),
        @ApiResponse(responseCode = "503", description = "Embedding service unavailable")
    })
    public ResponseEntity<RecommendResponse> recommend(@Valid @RequestBody RecommendRequest request) {
        log.info("Received recommend request: top_k={}, user={}, text={}",
                request.getTopK(), request.getUserId(), request.getQueryText());

        FilterCriteria diamondFilters = FilterCriteria.parse(Dataset.DIAMONDS, request.getDiamondFilters());
        FilterCriteria settingFilters = FilterCriteria.parse(Dataset.SETTINGS, request.getSettingFilters());
        EmbeddedQuery query = queryEmbedder.resolve(request.getVector(), request.getQueryText(), request.getImageBase64());

        RecommendationResult result = recommendationService.recommend(
            query, request.getTopK(), blankToNull(request.getUserId()), diamondFilters, settingFilters);

        QueryInfo info = QueryInfo.builder()
            .queryText(query.text())
            .hasImage(query.hasImage())
            .topK(request.getTopK())
            .resultCount(result.combinations().size())
            .hints(result.hints())
            .diamondCandidates(result.diamondCandidates())
            .settingCandidates(result.settingCandidates())
            .pairsScored(result.pairsScored())
            .prefilterBypassed(result.prefilterBypassed())
            .personalized(result.personalized())
            .collaborative(result.collaborative())
            .message(result.message())
            .build();
        return ResponseEntity.ok(new RecommendResponse(result.combinations(), info));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
