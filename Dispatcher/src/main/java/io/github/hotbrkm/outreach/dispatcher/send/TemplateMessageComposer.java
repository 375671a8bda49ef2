package io.github.hotbrkm.outreach.dispatcher.send;

import io.github.hotbrkm.outreach.dispatcher.config.CampaignConfigException;
import io.github.hotbrkm.outreach.dispatcher.config.CampaignProperties;
import io.github.hotbrkm.outreach.dispatcher.domain.Recipient;
import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link MessageComposer} that fills the configured subject/body templates with recipient fields.
 * <p>
 * First-touch templates rotate by recipient key, so the same recipient always gets the same template.
 * Follow-up n uses the n-th follow-up template (the last one repeats). Filler messages pick a random subject.
 */
public class TemplateMessageComposer implements MessageComposer {

    static final Set<String> PLACEHOLDERS = Set.of(
            "{{First Name}}", "{{Last Name}}", "{{Company Name}}", "{{Title}}",
            "{{City}}", "{{State}}", "{{Country}}", "{{industry or location}}");

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{[^}]+}}");

    private final List<CampaignProperties.Template> firstTouchTemplates;
    private final List<CampaignProperties.Template> followUpTemplates;
    private final List<String> fillerSubjects;
    private final String fillerBody;
    private final Random random;

    /**
     * @throws CampaignConfigException if a template list is empty or uses an unknown placeholder, or if filler
     *                                 addresses are configured without any filler subject
     */
    public TemplateMessageComposer(CampaignProperties.Templates templates, CampaignProperties.Filler filler, Random random) {
        Objects.requireNonNull(templates, "templates must not be null");
        Objects.requireNonNull(filler, "filler must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.firstTouchTemplates = validated("first-touch", templates.getFirstTouch());
        this.followUpTemplates = validated("follow-up", templates.getFollowUp());
        this.fillerSubjects = filler.getSubjects() == null ? List.of()
                : filler.getSubjects().stream().filter(subject -> subject != null && !subject.isBlank()).toList();
        if (fillerSubjects.isEmpty() && hasAddresses(filler)) {
            throw new CampaignConfigException("campaign.filler.subjects must not be empty when filler addresses are configured");
        }
        this.fillerBody = filler.getBody() == null ? "" : filler.getBody();
    }

    @Override
    public ComposedMessage compose(Recipient recipient, TrafficCategory category, Integer sequence) {
        Objects.requireNonNull(recipient, "recipient must not be null");
        Objects.requireNonNull(category, "category must not be null");
        return switch (category) {
            case FIRST_TOUCH -> {
                int index = Math.floorMod(recipient.key().hashCode(), firstTouchTemplates.size());
                yield render(firstTouchTemplates.get(index), recipient, "Template " + (index + 1));
            }
            case FOLLOW_UP -> {
                if (sequence == null || sequence < 1) {
                    throw new IllegalArgumentException("Follow-up sequence must be >= 1 for " + recipient.key());
                }
                int index = Math.min(sequence, followUpTemplates.size()) - 1;
                yield render(followUpTemplates.get(index), recipient, "Follow-up " + sequence);
            }
            case FILLER -> {
                if (fillerSubjects.isEmpty()) {
                    throw new IllegalStateException("No filler subjects configured");
                }
                yield new ComposedMessage(fillerSubjects.get(random.nextInt(fillerSubjects.size())), fillerBody, "");
            }
        };
    }

    private ComposedMessage render(CampaignProperties.Template template, Recipient recipient, String label) {
        Map<String, String> values = values(recipient);
        return new ComposedMessage(substitute(template.getSubject(), values), substitute(template.getBody(), values), label);
    }

    static Map<String, String> values(Recipient recipient) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("{{Company Name}}", orDefault(recipient.getOrganization(), "your company"));
        values.put("{{First Name}}", orDefault(recipient.getFirstName(), "there"));
        values.put("{{Last Name}}", recipient.getLastName());
        values.put("{{Title}}", recipient.getTitle());
        values.put("{{City}}", recipient.getCity());
        values.put("{{State}}", recipient.getState());
        values.put("{{Country}}", recipient.getCountry());
        values.put("{{industry or location}}", industryOrLocation(recipient));
        return values;
    }

    /**
     * Industry in lower case, else "city, state, country" (country left out for US), else "your area".
     */
    static String industryOrLocation(Recipient recipient) {
        if (!recipient.getIndustry().isEmpty()) {
            return recipient.getIndustry().toLowerCase(Locale.ROOT);
        }
        List<String> parts = new ArrayList<>();
        if (!recipient.getCity().isEmpty()) {
            parts.add(recipient.getCity());
        }
        if (!recipient.getState().isEmpty()) {
            parts.add(recipient.getState());
        }
        if (!recipient.getCountry().isEmpty() && !recipient.getCountry().equalsIgnoreCase("US")) {
            parts.add(recipient.getCountry());
        }
        return parts.isEmpty() ? "your area" : String.join(", ", parts);
    }

    private static String substitute(String text, Map<String, String> values) {
        if (text == null) {
            return "";
        }
        String result = text;
        for (Map.Entry<String, String> value : values.entrySet()) {
            result = result.replace(value.getKey(), value.getValue());
        }
        return result;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }

    private static boolean hasAddresses(CampaignProperties.Filler filler) {
        return filler.getAddresses() != null
                && filler.getAddresses().stream().anyMatch(address -> address != null && !address.isBlank());
    }

    private static List<CampaignProperties.Template> validated(String kind, List<CampaignProperties.Template> templates) {
        if (templates == null || templates.isEmpty()) {
            throw new CampaignConfigException("At least one " + kind + " template must be configured");
        }
        for (int i = 0; i < templates.size(); i++) {
            CampaignProperties.Template template = templates.get(i);
            if (template == null || template.getSubject() == null || template.getSubject().isBlank()) {
                throw new CampaignConfigException(kind + " template " + (i + 1) + " has no subject");
            }
            checkPlaceholders(kind, i, template.getSubject());
            checkPlaceholders(kind, i, template.getBody());
        }
        return List.copyOf(templates);
    }

    private static void checkPlaceholders(String kind, int index, String text) {
        if (text == null) {
            return;
        }
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(text);
        while (matcher.find()) {
            if (!PLACEHOLDERS.contains(matcher.group())) {
                throw new CampaignConfigException(
                        "Unknown placeholder " + matcher.group() + " in " + kind + " template " + (index + 1));
            }
        }
    }
}
