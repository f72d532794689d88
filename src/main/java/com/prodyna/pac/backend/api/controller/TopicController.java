package com.prodyna.pac.backend.api.controller;

import com.prodyna.pac.backend.api.dto.TalkResponse;
import com.prodyna.pac.backend.api.dto.TopicRequest;
import com.prodyna.pac.backend.api.dto.TopicResponse;
import com.prodyna.pac.backend.domain.model.Topic;
import com.prodyna.pac.backend.service.TalkStore;
import com.prodyna.pac.backend.service.TopicStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for topics, their sub-topics and the talks covering them.
 *
 * @author PAC Team
 */
@RestController
@RequestMapping("/topics")
public class TopicController extends CrudController<Topic, TopicRequest, TopicResponse> {

    private final TopicStore topicStore;
    private final TalkStore talkStore;

    public TopicController(TopicStore topicStore, TalkStore talkStore) {
        super(topicStore);
        this.topicStore = topicStore;
        this.talkStore = talkStore;
    }

    /**
     * Get the direct sub-topics of a topic.
     *
     * @param id Topic ID
     * @return Children of the topic, empty if none
     */
    @GetMapping("/{id:[0-9]+}/children")
    public ResponseEntity<List<TopicResponse>> getChildren(@PathVariable("id") Long id) {
        return ResponseEntity.ok(toResponses(topicStore.findByParentId(id)));
    }

    /**
     * Get all talks covering a topic.
     *
     * @param id Topic ID
     * @return Talks about the topic, empty if none
     */
    @GetMapping("/{id:[0-9]+}/talks")
    public ResponseEntity<List<TalkResponse>> getTalks(@PathVariable("id") Long id) {
        List<TalkResponse> talks = talkStore.findByTopicId(id).stream()
                .map(TalkResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(talks);
    }

    @Override
    protected Topic toEntity(TopicRequest request) {
        return request.toEntity();
    }

    @Override
    protected TopicResponse toResponse(Topic entity) {
        return TopicResponse.fromEntity(entity);
    }
}
