package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Person;
import com.prodyna.pac.backend.domain.model.Talk;
import com.prodyna.pac.backend.domain.model.TalkDate;
import com.prodyna.pac.backend.domain.model.TalkLevel;
import com.prodyna.pac.backend.domain.model.Topic;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Request DTO for creating or replacing a talk.
 *
 * Persons and topics are referenced by id. Talk dates are given in full and
 * replace all existing dates of the talk. An unknown level is left unset so
 * that it is reported together with every other violation.
 *
 * @author PAC Team
 */
public class TalkRequest {

    private String title;
    private Integer durationInMinutes;
    private String language;
    private String level;
    private List<Long> personIds = new ArrayList<>();
    private List<Long> topicIds = new ArrayList<>();
    private List<TalkDateRequest> talkDates = new ArrayList<>();

    public TalkRequest() {
    }

    public Talk toEntity() {
        Talk talk = Talk.builder()
                .title(title)
                .durationInMinutes(durationInMinutes)
                .language(language)
                .level(TalkLevel.fromValue(level).orElse(null))
                .persons(toPersons())
                .topics(toTopics())
                .build();

        List<TalkDate> dates = new ArrayList<>();
        if (talkDates != null) {
            for (TalkDateRequest date : talkDates) {
                dates.add(date != null ? date.toEntity() : new TalkDate());
            }
        }
        talk.replaceTalkDates(dates);
        return talk;
    }

    // One reference per list entry, a null id becoming an id-less reference.
    // Entities compare by identity, so the set keeps every entry in request order
    // and the store reports violations at the index the client sent.
    private Set<Person> toPersons() {
        Set<Person> persons = new LinkedHashSet<>();
        if (personIds != null) {
            for (Long id : personIds) {
                persons.add(Person.builder().id(id).build());
            }
        }
        return persons;
    }

    private Set<Topic> toTopics() {
        Set<Topic> topics = new LinkedHashSet<>();
        if (topicIds != null) {
            for (Long id : topicIds) {
                topics.add(Topic.builder().id(id).build());
            }
        }
        return topics;
    }

    // Getters and setters
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

    public String getLevel() {
        return level;
    }

    public void setLevel(String level) {
        this.level = level;
    }

    public List<Long> getPersonIds() {
        return personIds;
    }

    public void setPersonIds(List<Long> personIds) {
        this.personIds = personIds;
    }

    public List<Long> getTopicIds() {
        return topicIds;
    }

    public void setTopicIds(List<Long> topicIds) {
        this.topicIds = topicIds;
    }

    public List<TalkDateRequest> getTalkDates() {
        return talkDates;
    }

    public void setTalkDates(List<TalkDateRequest> talkDates) {
        this.talkDates = talkDates;
    }
}
