package com.bit.werewolf.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * 投票事件发布
 */
@Slf4j
@Component
public class VoteEventPublisher {

    @Autowired
    private ApplicationEventPublisher publisher;

    public void publish(VoteEventType type, int turn, Object... keyValues) {
        VoteEvent event = new VoteEvent(type, turn, VoteEvent.fields(keyValues));
        log.debug("发布事件 {}", event);
        publisher.publishEvent(event);
    }
}
