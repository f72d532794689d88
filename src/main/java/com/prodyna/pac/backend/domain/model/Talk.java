package com.prodyna.pac.backend.domain.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A talk held by one or more persons, covering one or more topics, scheduled
 * into rooms of events through its talk dates.
 *
 * Relations are loaded through {@link #DETAIL_GRAPH}; outside of it every
 * collection is lazy. Persons and topics are ordered by id, talk dates by
 * begin time.
 *
 * @author PAC Team
 */
@Entity
@Table(name = "talk")
@NamedEntityGraph(
    name = Talk.DETAIL_GRAPH,
    attributeNodes = {
        @NamedAttributeNode(value = "persons", subgraph = "persons"),
        @NamedAttributeNode(value = "topics", subgraph = "topics"),
        @NamedAttributeNode(value = "talkDates", subgraph = "talkDates")
    },
    subgraphs = {
        @NamedSubgraph(name = "persons", attributeNodes = @NamedAttributeNode("organization")),
        @NamedSubgraph(name = "topics", attributeNodes = @NamedAttributeNode("children")),
        @NamedSubgraph(name = "talkDates", attributeNodes = {
            @NamedAttributeNode("room"),
            @NamedAttributeNode("event")
        })
    }
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Talk implements Identifiable {

    public static final String DETAIL_GRAPH = "Talk.detail";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @NotBlank
    @Size(max = 255)
    @Column(name = "title", nullable = false)
    private String title;

    @NotNull
    @Positive
    @Column(name = "duration_in_minutes", nullable = false)
    private Integer durationInMinutes;

    @NotBlank
    @Size(max = 64)
    @Column(name = "language", nullable = false, length = 64)
    private String language;

    @NotNull(message = "must be one of: beginner, advanced, expert")
    @Enumerated(EnumType.STRING)
    @Column(name = "level", nullable = false, length = 20)
    private TalkLevel level;

    @ManyToMany
    @JoinTable(name = "talks_at",
            joinColumns = @JoinColumn(name = "talk_id"),
            inverseJoinColumns = @JoinColumn(name = "person_id"))
    @OrderBy("id")
    @Builder.Default
    private Set<Person> persons = new LinkedHashSet<>();

    @ManyToMany
    @JoinTable(name = "talk_topic",
            joinColumns = @JoinColumn(name = "talk_id"),
            inverseJoinColumns = @JoinColumn(name = "topic_id"))
    @OrderBy("id")
    @Builder.Default
    private Set<Topic> topics = new LinkedHashSet<>();

    @OneToMany(mappedBy = "talk", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("beginTime, id")
    @Builder.Default
    private Set<TalkDate> talkDates = new LinkedHashSet<>();

    /**
     * Replace all talk dates, keeping the managed collection instance so that
     * removed dates are deleted as orphans.
     */
    public void replaceTalkDates(Collection<TalkDate> dates) {
        talkDates.clear();
        for (TalkDate date : dates) {
            date.setTalk(this);
            talkDates.add(date);
        }
    }
}
