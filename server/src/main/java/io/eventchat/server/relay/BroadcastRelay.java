// file: src/main/java/io/eventchat/server/relay/BroadcastRelay.java
package io.eventchat.server.relay;

import io.eventchat.server.hub.ConnectionHub;
import io.eventchat.server.loop.ChatEventLoop;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Channel from threads outside the chat loop to the hub.
 * <p>
 * Workers {@link #submit} commands; a dedicated daemon thread drains the queue
 * and re-submits each command onto the {@link ChatEventLoop}, where the hub
 * performs the broadcast. Commands are delivered in submission order.
 */
public final class BroadcastRelay implements AutoCloseable {
    private static final Logger log = Logger.getLogger(BroadcastRelay.class.getName());

    public static final String THREAD_NAME = "broadcast-relay";

    private final BlockingQueue<BroadcastCommand> queue = new LinkedBlockingQueue<>();
    private final ConnectionHub hub;
    private final ChatEventLoop loop;
    private final Thread worker;
    private volatile boolean running;

    public BroadcastRelay(ConnectionHub hub, ChatEventLoop loop) {
        this.hub = hub;
        this.loop = loop;
        this.worker = new Thread(this::drain, THREAD_NAME);
        this.worker.setDaemon(true);
    }

    public void start() {
        running = true;
        worker.start();
    }

    /** Enqueue a broadcast. Safe from any thread. */
    public void submit(BroadcastCommand command) {
        if (!running) {
            log.warning("relay not running; dropping broadcast to conversation " + command.conversationId());
            return;
        }
        queue.add(command);
    }

    /** Commands accepted but not yet handed to the loop. */
    public int pending() {
        return queue.size();
    }

    private void drain() {
        while (running) {
            BroadcastCommand cmd;
            try {
                cmd = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            loop.execute(() -> {
                int delivered = hub.broadcast(cmd.conversationId(), cmd.excludeParticipantId(), cmd.payload());
                log.log(Level.FINE, () -> "relayed broadcast to conversation " + cmd.conversationId()
                        + " reached " + delivered + " connection(s)");
            });
        }
    }

    @Override
    public void close() {
        running = false;
        worker.interrupt();
        try {
            worker.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
