package com.prodyna.pac.backend.service;

import com.prodyna.pac.backend.domain.model.Event;
import com.prodyna.pac.backend.domain.model.Person;
import com.prodyna.pac.backend.domain.model.Room;
import com.prodyna.pac.backend.domain.model.Talk;
import com.prodyna.pac.backend.domain.model.TalkDate;
import com.prodyna.pac.backend.domain.model.TalkLevel;
import com.prodyna.pac.backend.domain.model.Topic;
import com.prodyna.pac.backend.exception.FieldViolation;
import com.prodyna.pac.backend.exception.ValidationFailedException;
import com.prodyna.pac.backend.infrastructure.metrics.StoreMetricsService;
import com.prodyna.pac.backend.repository.EventRepository;
import com.prodyna.pac.backend.repository.PersonRepository;
import com.prodyna.pac.backend.repository.RoomRepository;
import com.prodyna.pac.backend.repository.TalkRepository;
import com.prodyna.pac.backend.repository.TopicRepository;
import com.prodyna.pac.backend.testutil.TestDataBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.persistence.EntityManager;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TalkStore.
 * Tests reference resolution, talk date checks and relation queries.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TalkStore Unit Tests")
class TalkStoreTest {

    @Mock
    private TalkRepository talkRepository;

    @Mock
    private PersonRepository personRepository;

    @Mock
    private TopicRepository topicRepository;

    @Mock
    private EventRepository eventRepository;

    @Mock
    private RoomRepository roomRepository;

    @Mock
    private EntityManager entityManager;

    private TalkStore talkStore;

    private Person person;
    private Topic topic;
    private Event event;
    private Room room;

    @BeforeEach
    void setUp() {
        EntityValidator validator = new EntityValidator(Validation.buildDefaultValidatorFactory().getValidator());
        talkStore = new TalkStore(talkRepository, personRepository, topicRepository, eventRepository,
                roomRepository, validator, entityManager, new StoreMetricsService(new SimpleMeterRegistry()));

        person = TestDataBuilder.withId(TestDataBuilder.person(null), 1L);
        topic = TestDataBuilder.withId(TestDataBuilder.topic("Java", null), 2L);
        event = TestDataBuilder.withId(TestDataBuilder.event(TestDataBuilder.locationRef(3L)), 4L);
        room = TestDataBuilder.withId(TestDataBuilder.room(TestDataBuilder.locationRef(3L)), 5L);
    }

    private Talk talkWithReferences() {
        return TestDataBuilder.talk(
                Person.builder().id(1L).build(),
                Topic.builder().id(2L).build(),
                TestDataBuilder.talkDate(Event.builder().id(4L).build(), Room.builder().id(5L).build()));
    }

    // ========================================
    // create() Tests
    // ========================================

    @Test
    @DisplayName("create - References are replaced by managed entities before saving")
    void create_Valid_ResolvesReferences() {
        // Given
        Talk talk = talkWithReferences();

        when(personRepository.findById(1L)).thenReturn(Optional.of(person));
        when(topicRepository.findById(2L)).thenReturn(Optional.of(topic));
        when(eventRepository.findById(4L)).thenReturn(Optional.of(event));
        when(roomRepository.findById(5L)).thenReturn(Optional.of(room));
        when(talkRepository.saveAndFlush(talk)).thenAnswer(invocation -> {
            Talk saved = invocation.getArgument(0);
            saved.setId(10L);
            return saved;
        });
        when(talkRepository.findById(10L)).thenReturn(Optional.of(talk));

        // When
        Talk result = talkStore.create(talk);

        // Then
        ArgumentCaptor<Talk> captor = ArgumentCaptor.forClass(Talk.class);
        verify(talkRepository).saveAndFlush(captor.capture());

        Talk saved = captor.getValue();
        assertThat(saved.getPersons()).containsExactly(person);
        assertThat(saved.getTopics()).containsExactly(topic);
        assertThat(saved.getTalkDates()).hasSize(1);

        TalkDate date = saved.getTalkDates().iterator().next();
        assertThat(date.getEvent()).isSameAs(event);
        assertThat(date.getRoom()).isSameAs(room);
        assertThat(date.getTalk()).isSameAs(saved);
        assertThat(result.getId()).isEqualTo(10L);
    }

    @Test
    @DisplayName("create - Unknown references are reported with constraint violations")
    void create_UnknownReferences_ThrowsValidationFailed() {
        // Given
        Talk talk = talkWithReferences();
        talk.setTitle(" ");

        when(personRepository.findById(1L)).thenReturn(Optional.empty());
        when(topicRepository.findById(2L)).thenReturn(Optional.of(topic));
        when(eventRepository.findById(4L)).thenReturn(Optional.empty());
        when(roomRepository.findById(5L)).thenReturn(Optional.of(room));

        // When / Then
        assertThatThrownBy(() -> talkStore.create(talk))
                .isInstanceOf(ValidationFailedException.class)
                .satisfies(ex -> assertThat(((ValidationFailedException) ex).getViolations())
                        .containsExactly(
                                new FieldViolation("title", "must not be blank"),
                                new FieldViolation("persons[0]", "Person with ID 1 does not exist"),
                                new FieldViolation("talkDates[0].event", "Event with ID 4 does not exist")));

        verify(talkRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("create - Missing level and talk date fields are all reported")
    void create_MissingLevelAndDateFields_ThrowsValidationFailed() {
        // Given
        Talk talk = TestDataBuilder.talk();
        talk.setLevel(null);
        talk.replaceTalkDates(List.of(new TalkDate()));

        // When / Then
        assertThatThrownBy(() -> talkStore.create(talk))
                .isInstanceOf(ValidationFailedException.class)
                .satisfies(ex -> assertThat(((ValidationFailedException) ex).getViolations())
                        .extracting(FieldViolation::getField)
                        .containsExactly(
                                "level",
                                "talkDates[0].event",
                                "talkDates[0].room",
                                "talkDates[0].beginTime",
                                "talkDates[0].endTime"));

        verifyNoInteractions(eventRepository, roomRepository);
    }

    @Test
    @DisplayName("create - Talk date ending before it begins is rejected")
    void create_EndBeforeBegin_ThrowsValidationFailed() {
        // Given
        Talk talk = talkWithReferences();
        TalkDate date = talk.getTalkDates().iterator().next();
        date.setEndTime(date.getBeginTime().minusMinutes(1));

        when(personRepository.findById(1L)).thenReturn(Optional.of(person));
        when(topicRepository.findById(2L)).thenReturn(Optional.of(topic));
        when(eventRepository.findById(4L)).thenReturn(Optional.of(event));
        when(roomRepository.findById(5L)).thenReturn(Optional.of(room));

        // When / Then
        assertThatThrownBy(() -> talkStore.create(talk))
                .isInstanceOf(ValidationFailedException.class)
                .satisfies(ex -> assertThat(((ValidationFailedException) ex).getViolations())
                        .containsExactly(new FieldViolation("talkDates[0].endTime", "must be after beginTime")));
    }

    // ========================================
    // update() Tests
    // ========================================

    @Test
    @DisplayName("update - Relations and talk dates are fully replaced")
    void update_Valid_ReplacesRelations() {
        // Given
        Person oldSpeaker = TestDataBuilder.withId(TestDataBuilder.person(null), 99L);
        Talk existing = TestDataBuilder.withId(TestDataBuilder.talk(oldSpeaker, topic,
                TestDataBuilder.talkDate(event, room)), 10L);
        TalkDate oldDate = existing.getTalkDates().iterator().next();

        Talk incoming = talkWithReferences();
        incoming.setTitle("Renamed");
        incoming.setLevel(TalkLevel.EXPERT);

        when(talkRepository.findById(10L)).thenReturn(Optional.of(existing));
        when(personRepository.findById(1L)).thenReturn(Optional.of(person));
        when(topicRepository.findById(2L)).thenReturn(Optional.of(topic));
        when(eventRepository.findById(4L)).thenReturn(Optional.of(event));
        when(roomRepository.findById(5L)).thenReturn(Optional.of(room));

        // When
        Talk result = talkStore.update(10L, incoming);

        // Then
        assertThat(result.getTitle()).isEqualTo("Renamed");
        assertThat(result.getLevel()).isEqualTo(TalkLevel.EXPERT);
        assertThat(result.getPersons()).containsExactly(person);
        assertThat(result.getTalkDates()).hasSize(1).doesNotContain(oldDate);
        assertThat(result.getTalkDates().iterator().next().getTalk()).isSameAs(existing);
        verify(talkRepository).saveAndFlush(existing);
    }

    // ========================================
    // Relation query Tests
    // ========================================

    @Test
    @DisplayName("findByEventId - Returns the talks of the event")
    void findByEventId_ReturnsTalks() {
        // Given
        Talk talk = TestDataBuilder.withId(TestDataBuilder.talk(), 10L);
        when(talkRepository.findByEventId(4L)).thenReturn(List.of(talk));

        // When
        List<Talk> result = talkStore.findByEventId(4L);

        // Then
        assertThat(result).containsExactly(talk);
    }

    @Test
    @DisplayName("findByPersonId - Returns empty list when the person holds no talks")
    void findByPersonId_NoTalks_ReturnsEmpty() {
        // Given
        when(talkRepository.findByPersonId(1L)).thenReturn(List.of());

        // When
        List<Talk> result = talkStore.findByPersonId(1L);

        // Then
        assertThat(result).isEmpty();
    }
}
