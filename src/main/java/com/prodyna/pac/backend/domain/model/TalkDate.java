package com.prodyna.pac.backend.domain.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A scheduled slot of a talk: when it is held, at which event and in which room.
 * Owned by its {@link Talk}; created, replaced and deleted together with it.
 *
 * @author PAC Team
 */
@Entity
@Table(name = "talk_date", indexes = {
    @Index(name = "idx_talk_date_talk", columnList = "talk_id"),
    @Index(name = "idx_talk_date_event", columnList = "event_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TalkDate implements Identifiable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "talk_id", nullable = false)
    private Talk talk;

    @NotNull
    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "event_id", nullable = false)
    private Event event;

    @NotNull
    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "room_id", nullable = false)
    private Room room;

    @NotNull
    @Column(name = "begin_time", nullable = false)
    private LocalDateTime beginTime;

    @NotNull
    @Column(name = "end_time", nullable = false)
    private LocalDateTime endTime;
}
