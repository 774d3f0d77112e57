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
 * Row of the nodes table. Metadata is stored as JSON text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("nodes")
public class NodeEntity {

    @Id
    private Long id;

    @Column("uri")
    private String uri;

    @Column("node_type")
    private String nodeType;

    @Column("name")
    private String name;

    @Column("content")
    private String content;

    @Column("metadata")
    private String metadata;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
