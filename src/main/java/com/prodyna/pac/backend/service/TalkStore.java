package com.prodyna.pac.backend.service;

import com.prodyna.pac.backend.domain.model.Talk;
import com.prodyna.pac.backend.domain.model.TalkDate;
import com.prodyna.pac.backend.exception.FieldViolation;
import com.prodyna.pac.backend.infrastructure.metrics.StoreMetricsService;
import com.prodyna.pac.backend.repository.EventRepository;
import com.prodyna.pac.backend.repository.PersonRepository;
import com.prodyna.pac.backend.repository.RoomRepository;
import com.prodyna.pac.backend.repository.TalkRepository;
import com.prodyna.pac.backend.repository.TopicRepository;
import jakarta.persistence.EntityManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Store for talks.
 *
 * A talk references existing persons and topics, and owns its talk dates,
 * each of which references an existing event and room. All references are
 * checked before anything is written.
 *
 * @author PAC Team
 */
@Service
public class TalkStore extends AbstractJpaStore<Talk> {

    private final TalkRepository talkRepository;
    private final PersonRepository personRepository;
    private final TopicRepository topicRepository;
    private final EventRepository eventRepository;
    private final RoomRepository roomRepository;

    public TalkStore(
            TalkRepository talkRepository,
            PersonRepository personRepository,
            TopicRepository topicRepository,
            EventRepository eventRepository,
            RoomRepository roomRepository,
            EntityValidator validator,
            EntityManager entityManager,
            StoreMetricsService metricsService
    ) {
        super("Talk", talkRepository, validator, entityManager, metricsService);
        this.talkRepository = talkRepository;
        this.personRepository = personRepository;
        this.topicRepository = topicRepository;
        this.eventRepository = eventRepository;
        this.roomRepository = roomRepository;
    }

    /**
     * Get all talks scheduled at an event.
     *
     * @param eventId Event ID
     * @return Talks of the event, empty if none
     */
    @Transactional(readOnly = true)
    public List<Talk> findByEventId(Long eventId) {
        return findRelated("findByEventId", eventId, () -> talkRepository.findByEventId(eventId));
    }

    /**
     * Get all talks held by a person.
     *
     * @param personId Person ID
     * @return Talks of the person, empty if none
     */
    @Transactional(readOnly = true)
    public List<Talk> findByPersonId(Long personId) {
        return findRelated("findByPersonId", personId, () -> talkRepository.findByPersonId(personId));
    }

    /**
     * Get all talks covering a topic.
     *
     * @param topicId Topic ID
     * @return Talks about the topic, empty if none
     */
    @Transactional(readOnly = true)
    public List<Talk> findByTopicId(Long topicId) {
        return findRelated("findByTopicId", topicId, () -> talkRepository.findByTopicId(topicId));
    }

    @Override
    protected void resolveReferences(Talk talk, List<FieldViolation> violations) {
        talk.setPersons(lookupAll(personRepository, talk.getPersons(), "persons", "Person", violations));
        talk.setTopics(lookupAll(topicRepository, talk.getTopics(), "topics", "Topic", violations));

        List<TalkDate> dates = new ArrayList<>();
        int index = 0;
        for (TalkDate date : talk.getTalkDates()) {
            String field = "talkDates[" + index++ + "]";
            if (date == null) {
                violations.add(new FieldViolation(field, "must not be null"));
                continue;
            }
            if (date.getEvent() == null) {
                violations.add(new FieldViolation(field + ".event", "must not be null"));
            }
            if (date.getRoom() == null) {
                violations.add(new FieldViolation(field + ".room", "must not be null"));
            }
            date.setEvent(lookup(eventRepository, date.getEvent(), field + ".event", "Event", violations));
            date.setRoom(lookup(roomRepository, date.getRoom(), field + ".room", "Room", violations));
            dates.add(date);
        }
        talk.replaceTalkDates(dates);
    }

    @Override
    protected void checkConsistency(Talk talk, List<FieldViolation> violations) {
        int index = 0;
        for (TalkDate date : talk.getTalkDates()) {
            String field = "talkDates[" + index++ + "]";
            if (date.getBeginTime() == null) {
                violations.add(new FieldViolation(field + ".beginTime", "must not be null"));
            }
            if (date.getEndTime() == null) {
                violations.add(new FieldViolation(field + ".endTime", "must not be null"));
            }
            if (date.getBeginTime() != null && date.getEndTime() != null
                    && !date.getEndTime().isAfter(date.getBeginTime())) {
                violations.add(new FieldViolation(field + ".endTime", "must be after beginTime"));
            }
        }
    }

    @Override
    protected void applyUpdate(Talk existing, Talk incoming) {
        existing.setTitle(incoming.getTitle());
        existing.setDurationInMinutes(incoming.getDurationInMinutes());
        existing.setLanguage(incoming.getLanguage());
        existing.setLevel(incoming.getLevel());

        existing.getPersons().clear();
        existing.getPersons().addAll(incoming.getPersons());
        existing.getTopics().clear();
        existing.getTopics().addAll(incoming.getTopics());
        existing.replaceTalkDates(new ArrayList<>(incoming.getTalkDates()));
    }
}
