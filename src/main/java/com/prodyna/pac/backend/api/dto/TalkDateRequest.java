package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Event;
import com.prodyna.pac.backend.domain.model.Room;
import com.prodyna.pac.backend.domain.model.TalkDate;

import java.time.LocalDateTime;

/**
 * One scheduled slot within a {@link TalkRequest}.
 *
 * @author PAC Team
 */
public class TalkDateRequest {

    private Long eventId;
    private Long roomId;
    private LocalDateTime beginTime;
    private LocalDateTime endTime;

    public TalkDateRequest() {
    }

    public TalkDateRequest(Long eventId, Long roomId, LocalDateTime beginTime, LocalDateTime endTime) {
        this.eventId = eventId;
        this.roomId = roomId;
        this.beginTime = beginTime;
        this.endTime = endTime;
    }

    public TalkDate toEntity() {
        return TalkDate.builder()
                .event(eventId != null ? Event.builder().id(eventId).build() : null)
                .room(roomId != null ? Room.builder().id(roomId).build() : null)
                .beginTime(beginTime)
                .endTime(endTime)
                .build();
    }

    // Getters and setters
    public Long getEventId() {
        return eventId;
    }

    public void setEventId(Long eventId) {
        this.eventId = eventId;
    }

    public Long getRoomId() {
        return roomId;
    }

    public void setRoomId(Long roomId) {
        this.roomId = roomId;
    }

    public LocalDateTime getBeginTime() {
        return beginTime;
    }

    public void setBeginTime(LocalDateTime beginTime) {
        this.beginTime = beginTime;
    }

    public LocalDateTime getEndTime() {
        return endTime;
    }

    public void setEndTime(LocalDateTime endTime) {
        this.endTime = endTime;
    }
}
