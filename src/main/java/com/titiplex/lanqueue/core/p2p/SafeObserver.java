package com.titiplex.lanqueue.core.p2p;

import com.titiplex.lanqueue.core.model.LanClipboardItem;
import com.titiplex.lanqueue.core.model.LanQueueMember;
import com.titiplex.lanqueue.core.model.LanQueueStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Keeps observer failures out of the network loops.
 */
final class SafeObserver implements LanQueueObserver {
    private static final Logger log = LoggerFactory.getLogger(SafeObserver.class);

    private final LanQueueObserver delegate;

    SafeObserver(LanQueueObserver delegate) {
        this.delegate = delegate;
    }

    @Override
    public void onStatus(LanQueueStatus status) {
        try {
            delegate.onStatus(status);
        } catch (RuntimeException e) {
            log.warn("status observer failed", e);
        }
    }

    @Override
    public void onMembers(List<LanQueueMember> members) {
        try {
            delegate.onMembers(members);
        } catch (RuntimeException e) {
            log.warn("members observer failed", e);
        }
    }

    @Override
    public void onItem(LanClipboardItem item) {
        try {
            delegate.onItem(item);
        } catch (RuntimeException e) {
            log.warn("item observer failed", e);
        }
    }
}
