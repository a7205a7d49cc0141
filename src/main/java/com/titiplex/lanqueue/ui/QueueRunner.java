package com.titiplex.lanqueue.ui;

import com.titiplex.lanqueue.core.model.LanQueueStatus;
import com.titiplex.lanqueue.core.model.Role;
import com.titiplex.lanqueue.core.p2p.LanQueueException;
import com.titiplex.lanqueue.core.p2p.LanQueueService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;

/**
 * Starts the configured role when the context is up, then keeps the process alive for as long
 * as the queue is in use.
 */
@Component
public class QueueRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(QueueRunner.class);

    private final LanQueueService queue;
    private final ConsoleBridge console;
    private final CountDownLatch closed = new CountDownLatch(1);

    @Value("${app.lanqueue.mode:off}")
    private String mode;
    @Value("${app.lanqueue.host:127.0.0.1}")
    private String host;
    @Value("${app.lanqueue.port:9001}")
    private int port;
    @Value("${app.lanqueue.password:}")
    private String password;
    @Value("${app.lanqueue.queue-name:}")
    private String queueName;
    @Value("${app.lanqueue.member-name:}")
    private String memberName;
    @Value("${app.lanqueue.console:false}")
    private boolean consoleEnabled;

    public QueueRunner(LanQueueService queue, ConsoleBridge console) {
        this.queue = queue;
        this.console = console;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            switch (mode.toLowerCase(Locale.ROOT)) {
                case "host" -> log.info("hosting: {}", console.statusJson(queue.startHost(port, password, queueName, memberName)));
                case "join" -> log.info("joined: {}", console.statusJson(queue.join(host, port, password, memberName)));
                case "off" -> log.debug("lan queue off");
                default -> log.warn("unknown app.lanqueue.mode '{}', staying off", mode);
            }
        } catch (LanQueueException e) {
            log.error("lan queue {} failed ({}): {}", mode, e.kind(), e.getMessage());
        }
    }

    /**
     * Blocks the caller: reads console lines when the console is enabled, otherwise waits until
     * shutdown or a disconnect. Returns at once when the queue is off.
     */
    public void awaitExit() throws InterruptedException {
        if (consoleEnabled) {
            readConsole();
            return;
        }
        if (queue.status().role() != Role.OFF) closed.await();
    }

    private void readConsole() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!console.handleLine(line, Instant.now().toString())) break;
            }
        } catch (IOException e) {
            log.warn("console closed: {}", e.getMessage());
        }
    }

    /**
     * A disconnected status means the role is over: a failed join, or the host went away.
     */
    @EventListener
    public void onQueueEvent(LanQueueEvent event) {
        if (LanQueueEvent.STATUS.equals(event.channel())
                && event.payload() instanceof LanQueueStatus status && !status.connected()) {
            log.debug("queue disconnected ({}), releasing runner", status.role());
            closed.countDown();
        }
    }

    @PreDestroy
    public void shutdown() {
        queue.leave();
        closed.countDown();
    }
}
