package io.github.hotbrkm.outreach.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "campaign")
public class CampaignProperties {

    private Quota quota = new Quota();
    private Retry retry = new Retry();
    private Pacing pacing = new Pacing();
    private FollowUp followUp = new FollowUp();
    private Schedule schedule = new Schedule();
    private LedgerStore ledger = new LedgerStore();
    private Smtp smtp = new Smtp();
    private Templates templates = new Templates();
    private Filler filler = new Filler();

    @Data
    public static class Quota {
        public static final int DEFAULT_FIRST_TOUCH_DAILY_CAP = 15;
        public static final int DEFAULT_FILLER_DAILY_CAP = 5;

        /**
         * Shared by first-touch and follow-up sends.
         */
        private int firstTouchDailyCap = DEFAULT_FIRST_TOUCH_DAILY_CAP;
        private int fillerDailyCap = DEFAULT_FILLER_DAILY_CAP;
    }

    @Data
    public static class Retry {
        public static final int DEFAULT_MAX_RETRIES = 3;
        public static final Duration DEFAULT_RETRY_WAIT = Duration.ofSeconds(5);

        /**
         * Total transport attempts per candidate.
         */
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryWait = DEFAULT_RETRY_WAIT;
    }

    @Data
    public static class Pacing {
        private Duration fillerMinDelay = Duration.ofSeconds(60);
        private Duration fillerMaxDelay = Duration.ofSeconds(180);
        private Duration outreachMinDelay = Duration.ofSeconds(30);
        private Duration outreachMaxDelay = Duration.ofSeconds(120);
    }

    @Data
    public static class FollowUp {
        public static final int DEFAULT_MAX_FOLLOWUPS = 3;

        private int maxFollowups = DEFAULT_MAX_FOLLOWUPS;

        /**
         * Wait in days before follow-up n (index n-1). The last value repeats if fewer than maxFollowups are given.
         */
        private List<Integer> intervalsDays = new ArrayList<>(List.of(7, 14, 21));
    }

    @Data
    public static class Schedule {
        public static final int DEFAULT_SUB_BATCH_SIZE = 3;
        public static final int DEFAULT_INITIAL_BURST_SIZE = 5;

        private int subBatchSize = DEFAULT_SUB_BATCH_SIZE;
        private int initialBurstSize = DEFAULT_INITIAL_BURST_SIZE;
    }

    @Data
    public static class LedgerStore {
        private String path = "sent_log.csv";
    }

    @Data
    public static class Smtp {
        private String host;
        private int port = 587;

        /**
         * STARTTLS, SSL, AUTO or NONE. Derived from the port when unset (587 STARTTLS, 465 SSL, otherwise AUTO).
         */
        private String security;
        private String username;
        private String password;
        private String fromAddress;
        private String fromName;
        private String contentType = "text/html";
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(60);
        private boolean verifyBeforeCycle = true;
        private boolean debug;

        public String resolveUsername() {
            return username == null || username.isBlank() ? fromAddress : username;
        }
    }

    @Data
    public static class Templates {
        private List<Template> firstTouch = new ArrayList<>(List.of(new Template(
                "Quick idea for {{Company Name}}",
                "<p>Hi {{First Name}},</p>\n\n<p>I work with teams in {{industry or location}} and had an idea for {{Company Name}}.</p>\n\n"
                        + "<p>Would you be open to a quick call this week?</p>")));
        private List<Template> followUp = new ArrayList<>(List.of(new Template(
                "Re: Quick idea for {{Company Name}}",
                "<p>Hi {{First Name}},</p>\n\n<p>Following up on my last note about {{Company Name}}.</p>\n\n"
                        + "<p>Is a short conversation worth it?</p>")));
    }

    @Data
    public static class Template {
        private String subject;
        private String body;

        public Template() {
        }

        public Template(String subject, String body) {
            this.subject = subject;
            this.body = body;
        }
    }

    @Data
    public static class Filler {
        private List<String> addresses = new ArrayList<>();
        private List<String> subjects = new ArrayList<>(List.of(
                "System Test",
                "Connection Check",
                "Delivery Test",
                "Mail System Verification",
                "SMTP Test Message"));
        private String body = "<p>This is an automated system test email.</p>\n\n"
                + "<p>This message is sent to verify email delivery.</p>\n\n"
                + "<p>Please disregard this message.</p>";
    }
}
