package com.pitchscope.service.stt.streaming;

import com.pitchscope.exception.ConnectionException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link RealtimeConnector} backed by OkHttp WebSockets.
 *
 * <p>OkHttp delivers inbound messages on its own reader thread; the listener converts them into
 * {@link RealtimeFrame}s on an unbounded queue that the session task drains with a timeout.
 */
public class OkHttpRealtimeConnector implements RealtimeConnector {

    private static final Logger LOG = LogManager.getLogger(OkHttpRealtimeConnector.class);

    static final int NORMAL_CLOSURE = 1000;

    private final OkHttpClient httpClient;
    private final Duration openTimeout;

    public OkHttpRealtimeConnector(OkHttpClient httpClient, Duration openTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.openTimeout = Objects.requireNonNull(openTimeout, "openTimeout must not be null");
    }

    @Override
    public RealtimeConnection connect(String url) {
        Request request;
        try {
            request = new Request.Builder().url(url).build();
        } catch (IllegalArgumentException e) {
            throw new ConnectionException("Invalid realtime URL", String.valueOf(url), e);
        }

        FrameQueueListener listener = new FrameQueueListener();
        WebSocket webSocket = httpClient.newWebSocket(request, listener);
        try {
            if (!listener.opened.await(openTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                webSocket.cancel();
                throw new ConnectionException("Timed out opening realtime connection after "
                        + openTimeout.toMillis() + "ms", url);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            webSocket.cancel();
            throw new ConnectionException("Interrupted while opening realtime connection", url, e);
        }

        Throwable openFailure = listener.openFailure.get();
        if (openFailure != null) {
            throw new ConnectionException("Failed to open realtime connection", url, openFailure);
        }
        LOG.debug("Realtime connection open: {}", url);
        return new WebSocketConnection(url, webSocket, listener.frames);
    }

    private static final class FrameQueueListener extends WebSocketListener {
        private final BlockingQueue<RealtimeFrame> frames = new LinkedBlockingQueue<>();
        private final CountDownLatch opened = new CountDownLatch(1);
        private final AtomicReference<Throwable> openFailure = new AtomicReference<>();

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            opened.countDown();
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            frames.offer(RealtimeFrame.text(text));
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            LOG.debug("Ignoring {} byte binary message from provider", bytes.size());
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            frames.offer(RealtimeFrame.closed(code, reason));
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            if (opened.getCount() > 0) {
                openFailure.set(t);
                opened.countDown();
                return;
            }
            frames.offer(RealtimeFrame.failure(t));
        }
    }

    private static final class WebSocketConnection implements RealtimeConnection {
        private final String url;
        private final WebSocket webSocket;
        private final BlockingQueue<RealtimeFrame> frames;

        private WebSocketConnection(String url, WebSocket webSocket, BlockingQueue<RealtimeFrame> frames) {
            this.url = url;
            this.webSocket = webSocket;
            this.frames = frames;
        }

        @Override
        public void sendBinary(byte[] chunk) {
            if (!webSocket.send(ByteString.of(chunk))) {
                throw new ConnectionException("Realtime connection rejected audio chunk", url);
            }
        }

        @Override
        public void sendText(String text) {
            if (!webSocket.send(text)) {
                throw new ConnectionException("Realtime connection rejected control message", url);
            }
        }

        @Override
        public Optional<RealtimeFrame> receive(Duration timeout) throws InterruptedException {
            return Optional.ofNullable(frames.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        }

        @Override
        public void close() {
            if (!webSocket.close(NORMAL_CLOSURE, "client done")) {
                webSocket.cancel();
            }
        }
    }
}
