package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Talk;
import com.prodyna.pac.backend.domain.model.TalkLevel;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for a talk with its persons, topics and talk dates.
 *
 * @author PAC Team
 */
public class TalkResponse {

    private Long id;
    private String title;
    private Integer durationInMinutes;
    private String language;
    private TalkLevel level;
    private List<PersonResponse> persons;
    private List<TopicResponse> topics;
    private List<TalkDateResponse> talkDates;

    public TalkResponse() {
    }

    public static TalkResponse fromEntity(Talk talk) {
        TalkResponse response = new TalkResponse();
        response.setId(talk.getId());
        response.setTitle(talk.getTitle());
        response.setDurationInMinutes(talk.getDurationInMinutes());
        response.setLanguage(talk.getLanguage());
        response.setLevel(talk.getLevel());
        response.setPersons(talk.getPersons().stream()
                .map(PersonResponse::fromEntity)
                .collect(Collectors.toList()));
        response.setTopics(talk.getTopics().stream()
                .map(TopicResponse::fromEntity)
                .collect(Collectors.toList()));
        response.setTalkDates(talk.getTalkDates().stream()
                .map(TalkDateResponse::fromEntity)
                .collect(Collectors.toList()));
        return response;
    }

    // Getters and setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Integer getDurationInMinutes() {
        return durationInMinutes;
    }

    public void setDurationInMinutes(Integer durationInMinutes) {
        this.durationInMinutes = durationInMinutes;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public TalkLevel getLevel() {
        return level;
    }

    public void setLevel(TalkLevel level) {
        this.level = level;
    }

    public List<PersonResponse> getPersons() {
        return persons;
    }

    public void setPersons(List<PersonResponse> persons) {
        this.persons = persons;
    }

    public List<TopicResponse> getTopics() {
        return topics;
    }

    public void setTopics(List<TopicResponse> topics) {
        this.topics = topics;
    }

    public List<TalkDateResponse> getTalkDates() {
        return talkDates;
    }

    public void setTalkDates(List<TalkDateResponse> talkDates) {
        this.talkDates = talkDates;
    }
}
