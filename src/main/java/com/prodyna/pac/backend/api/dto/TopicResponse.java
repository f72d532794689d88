package com.prodyna.pac.backend.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.prodyna.pac.backend.domain.model.Topic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for a topic.
 * Children are rendered one level deep as summaries without their own children.
 *
 * @author PAC Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TopicResponse {

    private Long id;
    private String name;
    private Long parentId;
    private List<TopicResponse> children;

    public TopicResponse() {
    }

    /**
     * Convert a topic with its loaded children.
     */
    public static TopicResponse fromEntity(Topic topic) {
        TopicResponse response = summaryOf(topic);
        response.setChildren(topic.getChildren().stream()
                .map(TopicResponse::summaryOf)
                .collect(Collectors.toList()));
        return response;
    }

    /**
     * Convert a topic without touching its children.
     */
    public static TopicResponse summaryOf(Topic topic) {
        TopicResponse response = new TopicResponse();
        response.setId(topic.getId());
        response.setName(topic.getName());
        response.setParentId(topic.getParent() != null ? topic.getParent().getId() : null);
        return response;
    }

    // Getters and setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
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

    public List<TopicResponse> getChildren() {
        return children;
    }

    public void setChildren(List<TopicResponse> children) {
        this.children = children;
    }
}
