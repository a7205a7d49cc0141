package com.titiplex.lanqueue.ui;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.lanqueue.core.model.LanClipboardItem;
import com.titiplex.lanqueue.core.model.LanQueueMember;
import com.titiplex.lanqueue.core.model.LanQueueStatus;
import com.titiplex.lanqueue.core.p2p.LanQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Text front end for the queue: renders queue events on stdout and turns console lines into
 * commands or text items.
 */
@Component
public class ConsoleBridge {
    private static final Logger log = LoggerFactory.getLogger(ConsoleBridge.class);

    private final LanQueueService queue;
    private final ObjectMapper mapper = new ObjectMapper();
    private final PrintStream out;

    @Autowired
    public ConsoleBridge(LanQueueService queue) {
        this(queue, System.out);
    }

    ConsoleBridge(LanQueueService queue, PrintStream out) {
        this.queue = queue;
        this.out = out;
    }

    @EventListener
    @SuppressWarnings("unchecked")
    public void onQueueEvent(LanQueueEvent event) {
        switch (event.channel()) {
            case LanQueueEvent.STATUS -> log.debug("status: {}", toJson(event.payload()));
            case LanQueueEvent.MEMBERS -> {
                List<LanQueueMember> members = (List<LanQueueMember>) event.payload();
                log.info("members ({}): {}", members.size(), toJson(members));
            }
            case LanQueueEvent.ITEM -> {
                LanClipboardItem item = (LanClipboardItem) event.payload();
                String from = item.senderName() != null ? item.senderName() : item.origin();
                if ("text".equals(item.kind())) {
                    out.println("[" + from + "] " + item.payload());
                } else {
                    out.println("[" + from + "] <" + item.kind() + ", " + item.payload().length() + " chars>");
                }
            }
            default -> log.debug("unknown channel {}", event.channel());
        }
    }

    /**
     * Handles one console line: {@code /status}, {@code /members}, {@code /leave}, or text to
     * share.
     *
     * @return false once the user asked to leave
     */
    public boolean handleLine(String line, String timestamp) {
        if (line == null) return true;
        String t = line.strip();
        if (t.isEmpty()) return true;
        switch (t) {
            case "/status" -> out.println(statusJson());
            case "/members" -> out.println(toJson(queue.members()));
            case "/leave" -> {
                queue.leave();
                return false;
            }
            default -> queue.send(LanClipboardItem.text(line, timestamp));
        }
        return true;
    }

    public String statusJson() {
        return statusJson(queue.status());
    }

    public String statusJson(LanQueueStatus status) {
        return toJson(status);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
