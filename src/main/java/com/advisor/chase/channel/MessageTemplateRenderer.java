package com.advisor.chase.channel;

import com.advisor.chase.model.ChaseAction;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.Channel;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Renders chase messages from templates keyed by "{type}.{tone}" or "{type}.escalation".
 * Email gets the full letter, SMS a condensed line, phone a short spoken script.
 */
@Component
public class MessageTemplateRenderer {

    private static final long DAY_MILLIS = 86_400_000L;

    private static final Map<String, String> FULL_TEMPLATES = Map.of(
            "document.friendly",
            "Hi {name}, I hope you're doing well! Just a friendly reminder that we're still waiting for your "
                    + "{description}. No rush, but whenever you get a chance it would help us move forward with "
                    + "your advice. Let me know if you need any help!",
            "document.gentle",
            "Hi {name}, just following up on our request for {description}. I know these things can slip "
                    + "through the cracks! If anything is unclear or you're having trouble finding what we need, "
                    + "I'm here to help.",
            "document.urgent",
            "Hi {name}, I wanted to reach out one more time about {description}. We really need this to "
                    + "finalize your advice and I don't want any delays on your end. Could you let me know if "
                    + "anything is blocking you from sending it over?",
            "document.escalation",
            "Hi {name}, we have asked for {description} {attempts} times over {days} days. Your advisor will "
                    + "call you personally to help get this sorted so your advice is not held up.",
            "loa.friendly",
            "Reference: {reference}. Following up on the Letter of Authority submitted {days} days ago for "
                    + "{client}. Please confirm receipt and the expected processing timeline.",
            "loa.gentle",
            "Reference: {reference}. Second follow-up on the Letter of Authority for {client}, submitted {days} "
                    + "days ago. This is now beyond your standard processing time. Please provide a status update.",
            "loa.urgent",
            "URGENT - Reference: {reference}. Follow-up on the Letter of Authority for {client}, submitted "
                    + "{days} days ago with no response. The client is waiting for advice. Please provide an "
                    + "immediate status update.",
            "loa.escalation",
            "URGENT - Reference: {reference}. The Letter of Authority for {client} has been chased {attempts} "
                    + "times over {days} days without a response. Please escalate to your relationship manager "
                    + "and provide an immediate status update.");

    private static final Map<String, String> SHORT_TEMPLATES = Map.of(
            "document", "Hi {name}, a reminder from your advisor: we still need your {description}.",
            "loa", "Ref {reference}: LOA for {client} outstanding {days} days. Please send a status update.");

    public String render(ChaseItem item, ChaseAction action, long now) {
        String key = action.getTemplateKey();
        String template = FULL_TEMPLATES.get(key);
        if (template == null) {
            throw new IllegalArgumentException("Unknown message template: " + key);
        }

        Channel channel = action.getChannel();
        if (channel == Channel.SMS || channel == Channel.PHONE) {
            String family = key.substring(0, key.indexOf('.'));
            String shortText = fill(SHORT_TEMPLATES.get(family), item, action, now);
            if (channel == Channel.SMS) {
                return shortText;
            }
            return "Hello, this is a call on behalf of your financial advisor. " + shortText
                    + " Thank you, goodbye.";
        }
        return fill(template, item, action, now);
    }

    private String fill(String template, ChaseItem item, ChaseAction action, long now) {
        long days = Math.max(0, (now - item.getCreatedAt()) / DAY_MILLIS);
        return template
                .replace("{name}", firstName(action.getRecipient() != null ? action.getRecipient().getName() : null))
                .replace("{description}", orDefault(item.getDescription(), "documents"))
                .replace("{reference}", orDefault(item.getReferenceNumber(), "N/A"))
                .replace("{client}", orDefault(item.getClientId(), "our client"))
                .replace("{attempts}", String.valueOf(item.getAttempts()))
                .replace("{days}", String.valueOf(days));
    }

    private static String firstName(String fullName) {
        if (fullName == null || fullName.isBlank()) return "there";
        return fullName.trim().split("\\s+")[0];
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
