package com.geoinsight.backend.controller;

import com.geoinsight.backend.dto.BatchEmbedRequest;
import com.geoinsight.backend.dto.BatchEmbedResponse;
import com.geoinsight.backend.dto.EmbeddingResponse;
import com.geoinsight.backend.dto.IndexStatsResponse;
import com.geoinsight.backend.dto.SimilaritySearchResponse;
import com.geoinsight.backend.dto.VectorSearchRequest;
import com.geoinsight.backend.exception.InvalidImageException;
import com.geoinsight.backend.model.EmbeddingRecord;
import com.geoinsight.backend.model.SimilarityMatch;
import com.geoinsight.backend.service.EmbeddingIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/similarity")
@Tag(name = "Similarity", description = "Visual property similarity index")
public class SimilarityController {

    private final EmbeddingIngestionService ingestionService;

    public SimilarityController(EmbeddingIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping(value = "/search/image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Search by image", description = "Find indexed properties that look like the uploaded photo")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matches, possibly empty"),
            @ApiResponse(responseCode = "422", description = "Image could not be read"),
            @ApiResponse(responseCode = "502", description = "Embedding model unavailable")
    })
    public ResponseEntity<SimilaritySearchResponse> searchByImage(
            @Parameter(description = "Query photo") @RequestPart("file") MultipartFile file,
            @RequestParam(required = false) Double threshold,
            @RequestParam(required = false) Integer limit) {

        List<SimilarityMatch> matches = ingestionService.searchByImage(readBytes(file), threshold, limit);
        return ResponseEntity.ok(toSearchResponse(matches, threshold));
    }

    @PostMapping("/search/vector")
    @Operation(summary = "Search by vector", description = "Find indexed properties closest to a raw embedding")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matches, possibly empty"),
            @ApiResponse(responseCode = "400", description = "Vector length does not match the index")
    })
    public ResponseEntity<SimilaritySearchResponse> searchByVector(@Valid @RequestBody VectorSearchRequest request) {
        double[] vector = request.getVector().stream().mapToDouble(Double::doubleValue).toArray();
        List<SimilarityMatch> matches = ingestionService.searchByVector(vector, request.getThreshold(), request.getLimit());
        return ResponseEntity.ok(toSearchResponse(matches, request.getThreshold()));
    }

    @PostMapping(value = "/properties/{propertyId}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Ingest property photo", description = "Store, embed and index the photo of a property")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Property indexed"),
            @ApiResponse(responseCode = "422", description = "Image could not be read"),
            @ApiResponse(responseCode = "502", description = "Embedding model unavailable")
    })
    public ResponseEntity<EmbeddingResponse> ingest(
            @Parameter(description = "Property ID") @PathVariable String propertyId,
            @RequestPart("file") MultipartFile file,
            @RequestParam(required = false) String address,
            @RequestParam(required = false) Double price) {

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (address != null) {
            metadata.put("address", address);
        }
        if (price != null) {
            metadata.put("price", price);
        }
        EmbeddingRecord record = ingestionService.ingestPhoto(propertyId, readBytes(file),
                file.getOriginalFilename(), file.getContentType(), metadata);
        return ResponseEntity.ok(toEmbeddingResponse(record));
    }

    @PostMapping("/batch")
    @Operation(summary = "Batch embed", description = "Re-embed the stored photos of several properties")
    public ResponseEntity<BatchEmbedResponse> batchEmbed(@Valid @RequestBody BatchEmbedRequest request) {
        return ResponseEntity.ok(ingestionService.batchEmbed(request.getPropertyIds(), request.isForce()));
    }

    @GetMapping("/properties/{propertyId}")
    @Operation(summary = "Get embedding", description = "Indexed metadata of a property")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Property is indexed"),
            @ApiResponse(responseCode = "404", description = "Property not indexed")
    })
    public ResponseEntity<EmbeddingResponse> get(
            @Parameter(description = "Property ID") @PathVariable String propertyId) {

        return ingestionService.find(propertyId)
                .map(record -> ResponseEntity.ok(toEmbeddingResponse(record)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/properties/{propertyId}")
    @Operation(summary = "Remove property", description = "Remove a property and its photo from the index")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Property removed"),
            @ApiResponse(responseCode = "404", description = "Property not indexed")
    })
    public ResponseEntity<Void> delete(
            @Parameter(description = "Property ID") @PathVariable String propertyId) {

        return ingestionService.delete(propertyId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/stats")
    @Operation(summary = "Index statistics")
    public ResponseEntity<IndexStatsResponse> stats() {
        return ResponseEntity.ok(IndexStatsResponse.builder()
                .count(ingestionService.size())
                .dimension(ingestionService.dimension())
                .defaultThreshold(ingestionService.resolveThreshold(null))
                .build());
    }

    private SimilaritySearchResponse toSearchResponse(List<SimilarityMatch> matches, Double threshold) {
        return SimilaritySearchResponse.builder()
                .matches(matches)
                .count(matches.size())
                .threshold(ingestionService.resolveThreshold(threshold))
                .build();
    }

    private static EmbeddingResponse toEmbeddingResponse(EmbeddingRecord record) {
        return EmbeddingResponse.builder()
                .propertyId(record.propertyId())
                .dimension(record.vector().length)
                .metadata(record.metadata())
                .build();
    }

    private static byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new InvalidImageException("Upload could not be read", e);
        }
    }
}
