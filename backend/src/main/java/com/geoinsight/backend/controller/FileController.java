package com.geoinsight.backend.controller;

import com.geoinsight.backend.service.FileStorageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.core.io.InputStreamResource;
import org.springframework.data.mongodb.gridfs.GridFsResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/files")
@Tag(name = "Files", description = "Property photo storage")
public class FileController {

    private final FileStorageService fileStorageService;

    public FileController(FileStorageService fileStorageService) {
        this.fileStorageService = fileStorageService;
    }

    @PostMapping(value = "/properties/{propertyId}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload photo", description = "Store or replace the photo of a property without indexing it")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Photo stored"),
            @ApiResponse(responseCode = "400", description = "Invalid file")
    })
    public ResponseEntity<Map<String, String>> uploadPhoto(
            @Parameter(description = "Property ID") @PathVariable String propertyId,
            @Parameter(description = "Photo to upload") @RequestParam("file") MultipartFile file) throws IOException {

        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "File is empty"));
        }
        String fileId = fileStorageService.storePhoto(propertyId, file.getBytes(),
                file.getOriginalFilename(), file.getContentType());
        return ResponseEntity.ok(Map.of(
                "fileId", fileId,
                "propertyId", propertyId,
                "url", fileStorageService.getPhotoUrl(propertyId),
                "size", String.valueOf(file.getSize())));
    }

    @GetMapping("/properties/{propertyId}")
    @Operation(summary = "Download photo", description = "Download the photo of a property")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Photo found"),
            @ApiResponse(responseCode = "404", description = "No photo for this property")
    })
    public ResponseEntity<InputStreamResource> downloadPhoto(
            @Parameter(description = "Property ID") @PathVariable String propertyId) throws IOException {

        Optional<GridFsResource> photo = fileStorageService.findPhoto(propertyId);
        if (photo.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        GridFsResource resource = photo.get();
        MediaType mediaType = resource.getContentType() != null
                ? MediaType.parseMediaType(resource.getContentType())
                : MediaType.APPLICATION_OCTET_STREAM;
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + resource.getFilename() + "\"")
                .contentType(mediaType)
                .body(new InputStreamResource(resource.getInputStream()));
    }

    @DeleteMapping("/properties/{propertyId}")
    @Operation(summary = "Delete photo", description = "Delete the photo of a property")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Photo deleted"),
            @ApiResponse(responseCode = "404", description = "No photo for this property")
    })
    public ResponseEntity<Void> deletePhoto(
            @Parameter(description = "Property ID") @PathVariable String propertyId) {

        return fileStorageService.deletePhoto(propertyId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
