package com.titiplex.lanqueue.ui;

import com.titiplex.lanqueue.core.model.LanClipboardItem;
import com.titiplex.lanqueue.core.model.LanQueueMember;
import com.titiplex.lanqueue.core.model.LanQueueStatus;
import com.titiplex.lanqueue.core.p2p.LanQueueObserver;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Bridges queue notifications to Spring application events.
 */
@Component
public class SpringEventObserver implements LanQueueObserver {
    private final ApplicationEventPublisher publisher;

    public SpringEventObserver(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void onStatus(LanQueueStatus status) {
        publisher.publishEvent(new LanQueueEvent(this, LanQueueEvent.STATUS, status));
    }

    @Override
    public void onMembers(List<LanQueueMember> members) {
        publisher.publishEvent(new LanQueueEvent(this, LanQueueEvent.MEMBERS, new ArrayList<>(members)));
    }

    @Override
    public void onItem(LanClipboardItem item) {
        publisher.publishEvent(new LanQueueEvent(this, LanQueueEvent.ITEM, item));
    }
}
