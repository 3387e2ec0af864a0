package com.geoinsight.backend;

import com.geoinsight.backend.provider.AmenityProvider;
import com.geoinsight.backend.provider.AreaImageProvider;
import com.geoinsight.backend.provider.EmbeddingModel;
import com.geoinsight.backend.provider.Geocoder;
import com.geoinsight.backend.provider.ReportSummarizer;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Base class for E2E tests with TestContainers MongoDB and Redis.
 * External providers are mocked.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Testcontainers
public abstract class BaseE2ETest {

    @Container
    static MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:7.0");

    @Container
    static GenericContainer<?> redisContainer = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @MockBean
    protected Geocoder geocoder;

    @MockBean
    protected AmenityProvider amenityProvider;

    @MockBean
    protected AreaImageProvider areaImageProvider;

    @MockBean
    protected EmbeddingModel embeddingModel;

    @MockBean
    protected ReportSummarizer reportSummarizer;

    @DynamicPropertySource
    static void setProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongoDBContainer::getReplicaSetUrl);
        registry.add("spring.data.mongodb.database", () -> "geoinsight-test");
        registry.add("spring.data.redis.host", redisContainer::getHost);
        registry.add("spring.data.redis.port", () -> redisContainer.getMappedPort(6379));
    }
}
