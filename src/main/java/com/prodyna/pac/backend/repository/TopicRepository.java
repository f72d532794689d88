package com.prodyna.pac.backend.repository;

import com.prodyna.pac.backend.domain.model.Topic;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.EntityGraph.EntityGraphType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Topic entity.
 * Every finder loads the direct children of the topics it returns.
 *
 * @author PAC Team
 */
@Repository
public interface TopicRepository extends JpaRepository<Topic, Long> {

    @Override
    @EntityGraph(value = Topic.DETAIL_GRAPH, type = EntityGraphType.LOAD)
    List<Topic> findAll();

    @Override
    @EntityGraph(value = Topic.DETAIL_GRAPH, type = EntityGraphType.LOAD)
    Optional<Topic> findById(Long id);

    /**
     * Find the direct children of a topic.
     *
     * @param parentId Parent topic ID
     * @return Child topics
     */
    @EntityGraph(value = Topic.DETAIL_GRAPH, type = EntityGraphType.LOAD)
    List<Topic> findByParentId(Long parentId);
}
