package io.github.hotbrkm.outreach.dispatcher.send;

import io.github.hotbrkm.outreach.dispatcher.config.CampaignConfigException;
import io.github.hotbrkm.outreach.dispatcher.config.CampaignProperties;
import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.io.UnsupportedEncodingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * {@link MailTransport} that submits mail to a relay through Jakarta Mail.
 * <p>
 * Security follows the configured mode: {@code STARTTLS} (port 587), {@code SSL} (port 465),
 * {@code AUTO} (STARTTLS first, then SSL) or {@code NONE}. HTML bodies are sent as
 * multipart/alternative with a plain-text part derived from the HTML.
 */
@Slf4j
public class JakartaMailTransport implements MailTransport {

    private static final String CHARSET = "UTF-8";
    private static final Set<String> BLOCK_ELEMENTS = Set.of(
            "p", "div", "li", "ul", "ol", "h1", "h2", "h3", "h4", "h5", "h6", "blockquote", "table", "tr");

    public enum Security {
        STARTTLS, SSL, AUTO, NONE
    }

    private final CampaignProperties.Smtp smtp;
    private final Security security;

    public JakartaMailTransport(CampaignProperties.Smtp smtp) {
        this.smtp = Objects.requireNonNull(smtp, "smtp must not be null");
        if (smtp.getHost() == null || smtp.getHost().isBlank()) {
            throw new CampaignConfigException("campaign.smtp.host must be set");
        }
        if (smtp.getPort() <= 0 || smtp.getPort() > 65535) {
            throw new CampaignConfigException("campaign.smtp.port is out of range: " + smtp.getPort());
        }
        this.security = resolveSecurity(smtp);
    }

    static Security resolveSecurity(CampaignProperties.Smtp smtp) {
        String configured = smtp.getSecurity();
        if (configured != null && !configured.isBlank()) {
            try {
                return Security.valueOf(configured.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new CampaignConfigException("Unknown campaign.smtp.security: " + configured, e);
            }
        }
        return switch (smtp.getPort()) {
            case 587 -> Security.STARTTLS;
            case 465 -> Security.SSL;
            default -> Security.AUTO;
        };
    }

    public Security getSecurity() {
        return security;
    }

    @Override
    public DeliveryResult deliver(String from, String to, String subject, String body) {
        List<String> errors = new ArrayList<>();
        for (Security mode : modes()) {
            try {
                Session session = session(mode);
                MimeMessage message = buildMessage(session, from, to, subject, body);
                try (Transport transport = session.getTransport(protocol(mode))) {
                    connect(transport);
                    transport.sendMessage(message, new Address[]{new InternetAddress(to)});
                }
                log.debug("Delivered message. to={}, mode={}", to, mode);
                return DeliveryResult.delivered();
            } catch (MessagingException | UnsupportedEncodingException e) {
                log.debug("Delivery attempt failed. to={}, mode={}, reason={}", to, mode, e.getMessage());
                errors.add(mode + ": " + e.getMessage());
            }
        }
        return DeliveryResult.failure(String.join("; ", errors));
    }

    @Override
    public DeliveryResult verifyConnection() {
        List<String> errors = new ArrayList<>();
        for (Security mode : modes()) {
            try (Transport transport = session(mode).getTransport(protocol(mode))) {
                connect(transport);
                log.info("SMTP connection verified. host={}, port={}, mode={}", smtp.getHost(), smtp.getPort(), mode);
                return DeliveryResult.delivered();
            } catch (MessagingException e) {
                errors.add(mode + ": " + e.getMessage());
            }
        }
        log.warn("SMTP connection check failed. host={}, port={}, errors={}", smtp.getHost(), smtp.getPort(), errors);
        return DeliveryResult.failure(String.join("; ", errors));
    }

    private List<Security> modes() {
        return security == Security.AUTO ? List.of(Security.STARTTLS, Security.SSL) : List.of(security);
    }

    private void connect(Transport transport) throws MessagingException {
        String username = smtp.resolveUsername();
        if (hasCredentials()) {
            transport.connect(smtp.getHost(), smtp.getPort(), username, smtp.getPassword());
        } else {
            transport.connect(smtp.getHost(), smtp.getPort(), null, null);
        }
    }

    private boolean hasCredentials() {
        return smtp.getPassword() != null && !smtp.getPassword().isEmpty()
                && smtp.resolveUsername() != null && !smtp.resolveUsername().isBlank();
    }

    private Session session(Security mode) {
        String protocol = protocol(mode);
        String prefix = "mail." + protocol + ".";
        Properties props = new Properties();
        props.put(prefix + "host", smtp.getHost());
        props.put(prefix + "port", Integer.toString(smtp.getPort()));
        props.put(prefix + "auth", Boolean.toString(hasCredentials()));
        props.put(prefix + "connectiontimeout", Long.toString(smtp.getConnectTimeout().toMillis()));
        props.put(prefix + "timeout", Long.toString(smtp.getReadTimeout().toMillis()));
        props.put(prefix + "writetimeout", Long.toString(smtp.getReadTimeout().toMillis()));
        if (mode == Security.STARTTLS) {
            props.put(prefix + "starttls.enable", "true");
            props.put(prefix + "starttls.required", "true");
        } else if (mode == Security.SSL) {
            props.put(prefix + "ssl.enable", "true");
            props.put(prefix + "ssl.checkserveridentity", "true");
        }
        Session session = Session.getInstance(props);
        session.setDebug(smtp.isDebug());
        return session;
    }

    private static String protocol(Security mode) {
        return mode == Security.SSL ? "smtps" : "smtp";
    }

    private MimeMessage buildMessage(Session session, String from, String to, String subject, String body)
            throws MessagingException, UnsupportedEncodingException {
        MimeMessage message = new MimeMessage(session);
        String fromName = smtp.getFromName();
        message.setFrom(fromName == null || fromName.isBlank()
                ? new InternetAddress(from)
                : new InternetAddress(from, fromName, CHARSET));
        message.setRecipients(MimeMessage.RecipientType.TO, InternetAddress.parse(to));
        message.setSubject(subject, CHARSET);

        String text = body == null ? "" : body;
        if (isHtml()) {
            MimeBodyPart plainPart = new MimeBodyPart();
            plainPart.setText(htmlToText(text), CHARSET, "plain");
            MimeBodyPart htmlPart = new MimeBodyPart();
            htmlPart.setText(text, CHARSET, "html");
            MimeMultipart alternative = new MimeMultipart("alternative");
            alternative.addBodyPart(plainPart);
            alternative.addBodyPart(htmlPart);
            message.setContent(alternative);
        } else {
            message.setText(text, CHARSET);
        }
        message.saveChanges();
        return message;
    }

    private boolean isHtml() {
        String contentType = smtp.getContentType();
        return contentType == null || contentType.toLowerCase(Locale.ROOT).contains("html");
    }

    /**
     * Plain-text rendering of an HTML body: entities decoded, tags dropped, {@code <br>} kept as a line break and
     * block elements separated by a blank line.
     */
    static String htmlToText(String html) {
        Document document = Jsoup.parseBodyFragment(html == null ? "" : html);
        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    text.append(textNode.text().replace('\u00A0', ' '));
                } else if (node instanceof Element element && element.normalName().equals("br")) {
                    text.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && BLOCK_ELEMENTS.contains(element.normalName())) {
                    text.append("\n\n");
                }
            }
        }, document.body());
        return text.toString()
                .replaceAll("[ \\t]*\n[ \\t]*", "\n")
                .replaceAll("\n{3,}", "\n\n")
                .strip();
    }
}
