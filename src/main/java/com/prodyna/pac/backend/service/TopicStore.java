package com.prodyna.pac.backend.service;

import com.prodyna.pac.backend.domain.model.Topic;
import com.prodyna.pac.backend.exception.FieldViolation;
import com.prodyna.pac.backend.infrastructure.metrics.StoreMetricsService;
import com.prodyna.pac.backend.repository.TopicRepository;
import jakarta.persistence.EntityManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Store for topics. Keeps the topic hierarchy acyclic.
 *
 * @author PAC Team
 */
@Service
public class TopicStore extends AbstractJpaStore<Topic> {

    private final TopicRepository topicRepository;

    public TopicStore(
            TopicRepository topicRepository,
            EntityValidator validator,
            EntityManager entityManager,
            StoreMetricsService metricsService
    ) {
        super("Topic", topicRepository, validator, entityManager, metricsService);
        this.topicRepository = topicRepository;
    }

    /**
     * Get the direct children of a topic.
     *
     * @param parentId Parent topic ID
     * @return Child topics, empty if none
     */
    @Transactional(readOnly = true)
    public List<Topic> findByParentId(Long parentId) {
        return findRelated("findByParentId", parentId, () -> topicRepository.findByParentId(parentId));
    }

    @Override
    protected void resolveReferences(Topic topic, List<FieldViolation> violations) {
        topic.setParent(lookup(topicRepository, topic.getParent(), "parent", "Topic", violations));
    }

    @Override
    protected void checkConsistency(Topic topic, List<FieldViolation> violations) {
        if (topic.getId() == null || topic.getParent() == null) {
            return;
        }

        Set<Long> visited = new HashSet<>();
        Topic ancestor = topic.getParent();
        while (ancestor != null && visited.add(ancestor.getId())) {
            if (topic.getId().equals(ancestor.getId())) {
                violations.add(new FieldViolation("parent", "a topic cannot be its own ancestor"));
                return;
            }
            ancestor = ancestor.getParent();
        }
    }

    @Override
    protected void applyUpdate(Topic existing, Topic incoming) {
        existing.setName(incoming.getName());
        existing.setParent(incoming.getParent());
    }
}
