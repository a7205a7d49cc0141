package com.titiplex.lanqueue.core.p2p;

import com.titiplex.lanqueue.core.model.LanClipboardItem;
import com.titiplex.lanqueue.core.model.LanQueueMember;
import com.titiplex.lanqueue.core.model.LanQueueStatus;

import java.util.List;

public interface LanQueueService {
    LanQueueStatus startHost(int port, String password, String queueName, String memberName);

    LanQueueStatus join(String host, int port, String password, String memberName);

    void leave();

    void send(LanClipboardItem item);

    LanQueueStatus status();

    List<LanQueueMember> members();
}
