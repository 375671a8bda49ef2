package io.github.hotbrkm.outreach.dispatcher.send;

import org.subethamail.smtp.MessageHandler;
import org.subethamail.smtp.RejectException;
import org.subethamail.smtp.server.SMTPServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Helper to run an in-process SMTP relay for transport tests. Received messages are kept in memory.
 */
final class EmbeddedSmtpServer implements AutoCloseable {

    static final String HOST = "127.0.0.1";

    record ReceivedMessage(String from, List<String> recipients, String data) {
    }

    private final SMTPServer smtpServer;
    private final List<ReceivedMessage> messages;
    private final int port;

    private EmbeddedSmtpServer(SMTPServer smtpServer, List<ReceivedMessage> messages, int port) {
        this.smtpServer = smtpServer;
        this.messages = messages;
        this.port = port;
    }

    static EmbeddedSmtpServer start() throws IOException {
        return start(Set.of());
    }

    /**
     * @param rejectedRecipients recipients answered with 550 at RCPT TO
     */
    static EmbeddedSmtpServer start(Set<String> rejectedRecipients) throws IOException {
        int port = findFreePort();
        List<ReceivedMessage> messages = new CopyOnWriteArrayList<>();
        SMTPServer smtpServer = new SMTPServer.Builder()
                .messageHandlerFactory(context -> new RecordingHandler(messages, rejectedRecipients))
                .port(port)
                .bindAddress(InetAddress.getByName(HOST))
                .hostName("smtp.test")
                .build();
        smtpServer.start();
        waitUntilReady(port, Duration.ofSeconds(3));
        return new EmbeddedSmtpServer(smtpServer, messages, port);
    }

    static int unusedPort() throws IOException {
        return findFreePort();
    }

    int port() {
        return port;
    }

    List<ReceivedMessage> messages() {
        return List.copyOf(messages);
    }

    @Override
    public void close() {
        smtpServer.stop();
    }

    private static final class RecordingHandler implements MessageHandler {
        private final List<ReceivedMessage> messages;
        private final Set<String> rejectedRecipients;
        private final List<String> recipients = new ArrayList<>();
        private String from;

        private RecordingHandler(List<ReceivedMessage> messages, Set<String> rejectedRecipients) {
            this.messages = messages;
            this.rejectedRecipients = rejectedRecipients;
        }

        @Override
        public void from(String from) {
            this.from = from;
        }

        @Override
        public void recipient(String recipient) throws RejectException {
            if (rejectedRecipients.contains(recipient)) {
                throw new RejectException(550, "5.1.1 Mailbox unavailable");
            }
            recipients.add(recipient);
        }

        @Override
        public String data(InputStream data) throws RejectException {
            try {
                messages.add(new ReceivedMessage(from, List.copyOf(recipients),
                        new String(data.readAllBytes(), StandardCharsets.UTF_8)));
                return "OK";
            } catch (IOException e) {
                throw new UncheckedIOException("I/O error occurred while reading SMTP data.", e);
            }
        }

        @Override
        public void done() {
            // session state is per handler
        }
    }

    private static int findFreePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }

    private static void waitUntilReady(int port, Duration timeout) throws IOException {
        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        IOException lastError = null;

        while (System.nanoTime() < deadlineNanos) {
            try (Socket socket = new Socket()) {
                socket.connect(new InetSocketAddress(HOST, port), 200);
                return;
            } catch (IOException e) {
                lastError = e;
                try {
                    Thread.sleep(50L);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted while waiting for embedded SMTP startup", interrupted);
                }
            }
        }

        throw new IOException("Embedded SMTP server did not start in time on port " + port, lastError);
    }
}
