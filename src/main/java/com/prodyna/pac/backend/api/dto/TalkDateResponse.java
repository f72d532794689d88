package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.TalkDate;

import java.time.LocalDateTime;

/**
 * Response DTO for a talk date, embedding its event and room.
 *
 * @author PAC Team
 */
public class TalkDateResponse {

    private Long id;
    private EventResponse event;
    private RoomResponse room;
    private LocalDateTime beginTime;
    private LocalDateTime endTime;

    public TalkDateResponse() {
    }

    public static TalkDateResponse fromEntity(TalkDate talkDate) {
        TalkDateResponse response = new TalkDateResponse();
        response.setId(talkDate.getId());
        response.setEvent(EventResponse.fromEntity(talkDate.getEvent()));
        response.setRoom(RoomResponse.fromEntity(talkDate.getRoom()));
        response.setBeginTime(talkDate.getBeginTime());
        response.setEndTime(talkDate.getEndTime());
        return response;
    }

    // Getters and setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public EventResponse getEvent() {
        return event;
    }

    public void setEvent(EventResponse event) {
        this.event = event;
    }

    public RoomResponse getRoom() {
        return room;
    }

    public void setRoom(RoomResponse room) {
        this.room = room;
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
