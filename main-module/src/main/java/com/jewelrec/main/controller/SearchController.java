package com.jewelrec.main.controller;

import com.jewelrec.common.filter.FilterCriteria;
import com.jewelrec.common.model.Dataset;
import com.jewelrec.common.model.SearchResult;
import com.jewelrec.main.dto.QueryInfo;
import com.jewelrec.main.dto.SearchRequest;
import com.jewelrec.main.dto.SearchResponse;
import com.jewelrec.main.embedding.EmbeddedQuery;
import com.jewelrec.main.embedding.QueryEmbedder;
import com.jewelrec.main.service.SearchService;
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

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
@Tag(name = "Search", description = "Similarity search over a single item pool")
public class SearchController {

    private final QueryEmbedder queryEmbedder;
    private final SearchService searchService;

    @PostMapping
    @Operation(summary = "Search items",
               description = "Find the items of a dataset most similar to a text, image or vector query")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Search completed"),
        @ApiResponse(responseCode = "400", description = "Invalid query, dataset or filter"),
        @ApiResponse(responseCode = "503", description = "Embedding service unavailable")
    })
    public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        log.info("Received search request: dataset={}, top_k={}, text={}",
                request.getDataset(), request.getTopK(), request.getQueryText());

        Dataset dataset = Dataset.fromKey(request.getDataset());
        FilterCriteria criteria = FilterCriteria.parse(dataset, request.getFilters());
        EmbeddedQuery query = queryEmbedder.resolve(request.getVector(), request.getQueryText(), request.getImageBase64());

        List<SearchResult> results = searchService.search(dataset, query.vector(), request.getTopK(), criteria);
        QueryInfo info = QueryInfo.builder()
            .dataset(dataset.key())
            .queryText(query.text())
            .hasImage(query.hasImage())
            .topK(request.getTopK())
            .resultCount(results.size())
            .filters(criteria.isEmpty() ? null : criteria.toString())
            .message(results.isEmpty() ? "No items matched the query and filters" : null)
            .build();
        return ResponseEntity.ok(new SearchResponse(results, info));
    }
}
