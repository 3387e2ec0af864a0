package com.geoinsight.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Monotonic counter incremented with findAndModify.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "counters")
public class SequenceCounter {

    @Id
    private String id;

    private long value;
}
