package com.prodyna.pac.backend.api.controller;

import com.prodyna.pac.backend.api.exception.GlobalExceptionHandler;
import com.prodyna.pac.backend.domain.model.Event;
import com.prodyna.pac.backend.domain.model.Location;
import com.prodyna.pac.backend.domain.model.Organization;
import com.prodyna.pac.backend.domain.model.Person;
import com.prodyna.pac.backend.domain.model.Room;
import com.prodyna.pac.backend.domain.model.Talk;
import com.prodyna.pac.backend.domain.model.TalkDate;
import com.prodyna.pac.backend.domain.model.TalkLevel;
import com.prodyna.pac.backend.domain.model.Topic;
import com.prodyna.pac.backend.service.TalkStore;
import com.prodyna.pac.backend.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for TalkController using MockMvc.
 * Tests the mapping of id references in requests and of embedded relations in responses.
 */
@WebMvcTest(TalkController.class)
@ContextConfiguration(classes = {TalkController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("TalkController Tests")
class TalkControllerTest {

    private static final String TALK_BODY = """
            {
              "title": "Idiomatic Persistence",
              "durationInMinutes": 45,
              "language": "en",
              "level": "%s",
              "personIds": [1],
              "topicIds": [2],
              "talkDates": [
                {"eventId": 4, "roomId": 5, "beginTime": "2024-05-13T10:00:00", "endTime": "2024-05-13T10:45:00"}
              ]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TalkStore talkStore;

    private Talk storedTalk;

    @BeforeEach
    void setUp() {
        Location location = TestDataBuilder.withId(TestDataBuilder.location(), 3L);
        Organization organization = TestDataBuilder.withId(TestDataBuilder.organization(), 6L);
        Person person = TestDataBuilder.withId(TestDataBuilder.person(organization), 1L);
        Topic topic = TestDataBuilder.withId(TestDataBuilder.topic("Programming", null), 2L);
        topic.getChildren().add(TestDataBuilder.withId(TestDataBuilder.topic("Java", topic), 8L));
        Event event = TestDataBuilder.withId(TestDataBuilder.event(location), 4L);
        Room room = TestDataBuilder.withId(TestDataBuilder.room(location), 5L);
        TalkDate date = TestDataBuilder.withId(TestDataBuilder.talkDate(event, room), 9L);

        storedTalk = TestDataBuilder.withId(TestDataBuilder.talk(person, topic, date), 10L);
    }

    @Test
    @DisplayName("POST /talks - References by id are mapped to the entity")
    void create_MapsReferences() throws Exception {
        // Given
        when(talkStore.create(any(Talk.class))).thenReturn(storedTalk);

        // When
        mockMvc.perform(post("/talks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(TALK_BODY, "Advanced")))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "http://localhost/talks/10"));

        // Then
        ArgumentCaptor<Talk> captor = ArgumentCaptor.forClass(Talk.class);
        verify(talkStore).create(captor.capture());

        Talk talk = captor.getValue();
        assertThat(talk.getLevel()).isEqualTo(TalkLevel.ADVANCED);
        assertThat(talk.getPersons()).extracting(Person::getId).containsExactly(1L);
        assertThat(talk.getTopics()).extracting(Topic::getId).containsExactly(2L);
        assertThat(talk.getTalkDates()).singleElement().satisfies(date -> {
            assertThat(date.getEvent().getId()).isEqualTo(4L);
            assertThat(date.getRoom().getId()).isEqualTo(5L);
            assertThat(date.getBeginTime()).isEqualTo(LocalDateTime.of(2024, 5, 13, 10, 0));
            assertThat(date.getTalk()).isSameAs(talk);
        });
    }

    @Test
    @DisplayName("POST /talks - Unknown level is passed on unset for validation")
    void create_UnknownLevel_LeavesLevelUnset() throws Exception {
        // Given
        when(talkStore.create(any(Talk.class))).thenReturn(storedTalk);

        // When
        mockMvc.perform(post("/talks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(TALK_BODY, "guru")))
                .andExpect(status().isCreated());

        // Then
        ArgumentCaptor<Talk> captor = ArgumentCaptor.forClass(Talk.class);
        verify(talkStore).create(captor.capture());
        assertThat(captor.getValue().getLevel()).isNull();
    }

    @Test
    @DisplayName("GET /talks/{id} - Response embeds persons, topics and talk dates")
    void getById_EmbedsRelations() throws Exception {
        // Given
        when(talkStore.findById(10L)).thenReturn(storedTalk);

        // When / Then
        mockMvc.perform(get("/talks/{id}", 10))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(10))
                .andExpect(jsonPath("$.level").value("advanced"))
                .andExpect(jsonPath("$.persons", hasSize(1)))
                .andExpect(jsonPath("$.persons[0].organization.name").value("PRODYNA"))
                .andExpect(jsonPath("$.topics[0].name").value("Programming"))
                .andExpect(jsonPath("$.topics[0].children[0].name").value("Java"))
                .andExpect(jsonPath("$.talkDates[0].id").value(9))
                .andExpect(jsonPath("$.talkDates[0].event.beginDate").value("2024-05-13"))
                .andExpect(jsonPath("$.talkDates[0].room.location.name").value("Conference Center"))
                .andExpect(jsonPath("$.talkDates[0].beginTime").value("2024-05-13T10:00:00"));
    }

    @Test
    @DisplayName("PUT /talks/{id} - Returns the replaced talk")
    void update_Returns200() throws Exception {
        // Given
        when(talkStore.update(eq(10L), any(Talk.class))).thenReturn(storedTalk);

        // When / Then
        mockMvc.perform(put("/talks/{id}", 10)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(String.format(TALK_BODY, "advanced")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Idiomatic Persistence"));
    }
}
