package com.knowledgeengine.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Row of the relations table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("relations")
public class RelationEntity {

    @Id
    private Long id;

    @Column("source_uri")
    private String sourceUri;

    @Column("target_uri")
    private String targetUri;

    @Column("relation_type")
    private String relationType;

    @Column("weight")
    private Double weight;

    @Column("metadata")
    private String metadata;

    @Column("created_at")
    private LocalDateTime createdAt;
}
