package com.geoinsight.backend.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.gridfs.GridFSBucket;
import com.mongodb.client.gridfs.GridFSBuckets;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.gridfs.GridFsTemplate;

/**
 * GridFS access for property photos, stored in the {@code property_photos} bucket.
 */
@Configuration
public class MongoConfig {

    public static final String PHOTO_BUCKET = "property_photos";

    @Value("${spring.data.mongodb.database}")
    private String databaseName;

    @Bean
    public GridFsTemplate gridFsTemplate(MongoDatabaseFactory mongoDbFactory,
            MappingMongoConverter converter) {
        return new GridFsTemplate(mongoDbFactory, converter, PHOTO_BUCKET);
    }

    @Bean
    public GridFSBucket gridFSBucket(MongoClient mongoClient) {
        return GridFSBuckets.create(mongoClient.getDatabase(databaseName), PHOTO_BUCKET);
    }
}
