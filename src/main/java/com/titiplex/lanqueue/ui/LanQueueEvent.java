package com.titiplex.lanqueue.ui;

import org.springframework.context.ApplicationEvent;

/**
 * Queue notification published on a named channel. Payload is a
 * {@link com.titiplex.lanqueue.core.model.LanQueueStatus}, a list of
 * {@link com.titiplex.lanqueue.core.model.LanQueueMember} or a
 * {@link com.titiplex.lanqueue.core.model.LanClipboardItem}, depending on the channel.
 */
public class LanQueueEvent extends ApplicationEvent {
    public static final String STATUS = "lan-queue-status";
    public static final String MEMBERS = "lan-queue-members";
    public static final String ITEM = "lan-clipboard-item";

    private final String channel;
    private final Object payload;

    public LanQueueEvent(Object source, String channel, Object payload) {
        super(source);
        this.channel = channel;
        this.payload = payload;
    }

    public String channel() {
        return channel;
    }

    public Object payload() {
        return payload;
    }
}
