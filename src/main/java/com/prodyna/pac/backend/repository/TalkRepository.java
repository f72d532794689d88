package com.prodyna.pac.backend.repository;

import com.prodyna.pac.backend.domain.model.Talk;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.EntityGraph.EntityGraphType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Talk entity.
 *
 * Every finder loads {@link Talk#DETAIL_GRAPH}: persons with their organization,
 * topics with their children, and talk dates with room and event.
 *
 * @author PAC Team
 */
@Repository
public interface TalkRepository extends JpaRepository<Talk, Long> {

    @Override
    @EntityGraph(value = Talk.DETAIL_GRAPH, type = EntityGraphType.LOAD)
    List<Talk> findAll();

    @Override
    @EntityGraph(value = Talk.DETAIL_GRAPH, type = EntityGraphType.LOAD)
    Optional<Talk> findById(Long id);

    /**
     * Find talks scheduled at an event through at least one talk date.
     *
     * @param eventId Event ID
     * @return Talks of the event
     */
    @EntityGraph(value = Talk.DETAIL_GRAPH, type = EntityGraphType.LOAD)
    @Query("SELECT t FROM Talk t WHERE t.id IN "
            + "(SELECT td.talk.id FROM TalkDate td WHERE td.event.id = :eventId)")
    List<Talk> findByEventId(@Param("eventId") Long eventId);

    /**
     * Find talks held by a person (join table talks_at).
     *
     * @param personId Person ID
     * @return Talks of the person
     */
    @EntityGraph(value = Talk.DETAIL_GRAPH, type = EntityGraphType.LOAD)
    @Query("SELECT t FROM Talk t WHERE t.id IN "
            + "(SELECT pt.id FROM Talk pt JOIN pt.persons p WHERE p.id = :personId)")
    List<Talk> findByPersonId(@Param("personId") Long personId);

    /**
     * Find talks covering a topic (join table talk_topic).
     *
     * @param topicId Topic ID
     * @return Talks about the topic
     */
    @EntityGraph(value = Talk.DETAIL_GRAPH, type = EntityGraphType.LOAD)
    @Query("SELECT t FROM Talk t WHERE t.id IN "
            + "(SELECT tt.id FROM Talk tt JOIN tt.topics tp WHERE tp.id = :topicId)")
    List<Talk> findByTopicId(@Param("topicId") Long topicId);
}
