package com.geoinsight.backend.service;

import com.geoinsight.backend.BaseE2ETest;
import com.geoinsight.backend.support.TestImages;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.gridfs.GridFsResource;

import static org.junit.jupiter.api.Assertions.*;

class FileStorageServiceE2ETest extends BaseE2ETest {

    @Autowired
    private FileStorageService fileStorageService;

    @Test
    void shouldStoreAndFetchPhoto() {
        // Given
        byte[] content = TestImages.png(4, 4, 2);

        // When
        String fileId = fileStorageService.storePhoto("prop-store", content, "front.png", "image/png");

        // Then
        assertNotNull(fileId);
        GridFsResource resource = fileStorageService.findPhoto("prop-store").orElseThrow();
        assertEquals("front.png", resource.getFilename());
        assertArrayEquals(content, fileStorageService.fetchImage("prop-store").orElseThrow());
    }

    @Test
    void shouldReplacePreviousPhoto() {
        // Given
        String first = fileStorageService.storePhoto("prop-replace", TestImages.png(4, 4, 1), "old.png", "image/png");
        byte[] replacement = TestImages.png(6, 6, 6);

        // When
        String second = fileStorageService.storePhoto("prop-replace", replacement, "new.png", "image/png");

        // Then
        assertNotEquals(first, second);
        assertEquals("new.png", fileStorageService.findPhoto("prop-replace").orElseThrow().getFilename());
        assertArrayEquals(replacement, fileStorageService.fetchImage("prop-replace").orElseThrow());
    }

    @Test
    void shouldDeletePhoto() {
        // Given
        fileStorageService.storePhoto("prop-delete", TestImages.png(4, 4, 4), "gone.png", "image/png");

        // When
        boolean deleted = fileStorageService.deletePhoto("prop-delete");

        // Then
        assertTrue(deleted);
        assertFalse(fileStorageService.deletePhoto("prop-delete"));
        assertTrue(fileStorageService.fetchImage("prop-delete").isEmpty());
    }

    @Test
    void shouldGeneratePhotoUrl() {
        String url = fileStorageService.getPhotoUrl("prop-url");

        assertTrue(url.endsWith("/prop-url"));
    }
}
