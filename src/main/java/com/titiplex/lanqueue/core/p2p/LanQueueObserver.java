package com.titiplex.lanqueue.core.p2p;

import com.titiplex.lanqueue.core.model.LanClipboardItem;
import com.titiplex.lanqueue.core.model.LanQueueMember;
import com.titiplex.lanqueue.core.model.LanQueueStatus;

import java.util.List;

/**
 * Fire-and-forget sink for queue events (usually the UI). Called from network threads.
 */
public interface LanQueueObserver {
    void onStatus(LanQueueStatus status);

    /** Full membership snapshot, possibly empty. */
    void onMembers(List<LanQueueMember> members);

    void onItem(LanClipboardItem item);
}
