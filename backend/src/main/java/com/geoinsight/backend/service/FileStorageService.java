package com.geoinsight.backend.service;

import com.geoinsight.backend.exception.ProviderException;
import com.geoinsight.backend.provider.PropertyImageProvider;
import com.mongodb.client.gridfs.GridFSBucket;
import com.mongodb.client.gridfs.model.GridFSFile;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.gridfs.GridFsResource;
import org.springframework.data.mongodb.gridfs.GridFsTemplate;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Property photos in GridFS. Each property has at most one photo; storing a
 * new one replaces the old.
 */
@Service
public class FileStorageService implements PropertyImageProvider {

    private static final Logger log = LoggerFactory.getLogger(FileStorageService.class);

    private static final String PROPERTY_ID = "metadata.propertyId";

    private final GridFsTemplate gridFsTemplate;
    private final GridFSBucket gridFSBucket;

    public FileStorageService(GridFsTemplate gridFsTemplate, GridFSBucket gridFSBucket) {
        this.gridFsTemplate = gridFsTemplate;
        this.gridFSBucket = gridFSBucket;
    }

    /**
     * Store the photo of a property, replacing any previous one.
     *
     * @return GridFS file id
     */
    public String storePhoto(String propertyId, byte[] content, String filename, String contentType) {
        deletePhoto(propertyId);

        Document metadata = new Document();
        metadata.put("propertyId", propertyId);
        metadata.put("contentType", contentType);
        metadata.put("originalFilename", filename);

        ObjectId fileId = gridFsTemplate.store(
                new ByteArrayInputStream(content),
                filename != null ? filename : propertyId,
                contentType,
                metadata);

        log.info("Stored photo {} for property {} ({} bytes)", fileId, propertyId, content.length);
        return fileId.toString();
    }

    /**
     * Photo of a property as a GridFS resource.
     */
    public Optional<GridFsResource> findPhoto(String propertyId) {
        GridFSFile file = gridFsTemplate.findOne(new Query(Criteria.where(PROPERTY_ID).is(propertyId)));
        return Optional.ofNullable(file).map(gridFsTemplate::getResource);
    }

    @Override
    public Optional<byte[]> fetchImage(String propertyId) {
        GridFSFile file = gridFsTemplate.findOne(new Query(Criteria.where(PROPERTY_ID).is(propertyId)));
        if (file == null) {
            return Optional.empty();
        }
        try (InputStream in = gridFSBucket.openDownloadStream(file.getObjectId())) {
            return Optional.of(in.readAllBytes());
        } catch (IOException e) {
            throw new ProviderException("gridfs", "Failed to read photo of property " + propertyId, e);
        }
    }

    /**
     * Delete the photo of a property.
     *
     * @return whether a photo existed
     */
    public boolean deletePhoto(String propertyId) {
        Query query = new Query(Criteria.where(PROPERTY_ID).is(propertyId));
        boolean existed = gridFsTemplate.findOne(query) != null;
        if (existed) {
            gridFsTemplate.delete(query);
        }
        return existed;
    }

    /**
     * Generate a download URL for a property photo.
     */
    public String getPhotoUrl(String propertyId) {
        return "/api/files/properties/" + propertyId;
    }
}
