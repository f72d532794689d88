package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Topic;

/**
 * Request DTO for creating or replacing a topic.
 * The parent topic is optional and referenced by its id; children are never set directly.
 *
 * @author PAC Team
 */
public class TopicRequest {

    private String name;
    private Long parentId;

    public TopicRequest() {
    }

    public TopicRequest(String name, Long parentId) {
        this.name = name;
        this.parentId = parentId;
    }

    public Topic toEntity() {
        return Topic.builder()
                .name(name)
                .parent(parentId != null ? Topic.builder().id(parentId).build() : null)
                .build();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Long getParentId() {
        return parentId;
    }

    public void setParentId(Long parentId) {
        this.parentId = parentId;
    }
}
