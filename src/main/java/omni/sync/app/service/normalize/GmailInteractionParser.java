package omni.sync.app.service.normalize;

import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import lombok.extern.slf4j.Slf4j;
import omni.sync.app.entity.Interaction;
import omni.sync.app.entity.InteractionType;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.RawEvent;
import omni.sync.app.exception.MalformedPayloadException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Gmail message (format=full) to email interaction. Body prefers text/plain parts, then
 * HTML with tags stripped, then the snippet.
 */
@Slf4j
@Component
public class GmailInteractionParser implements InteractionParser {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();

    @Override
    public Provider provider() {
        return Provider.MAIL;
    }

    @Override
    public Interaction parse(RawEvent event) {
        Message message = read(event);
        if (message.getPayload() == null && message.getSnippet() == null) {
            throw new MalformedPayloadException("Gmail message " + event.getSourceId() + " has neither payload nor snippet");
        }

        String subject = null;
        List<String> participants = new ArrayList<>();
        if (message.getPayload() != null && message.getPayload().getHeaders() != null) {
            for (MessagePartHeader header : message.getPayload().getHeaders()) {
                if (header.getName() == null) {
                    continue;
                }
                String name = header.getName().toLowerCase(Locale.ROOT);
                String value = header.getValue();
                switch (name) {
                    case "subject":
                        subject = value;
                        break;
                    case "from":
                    case "to":
                    case "cc":
                        if (value != null) {
                            for (String address : value.split(",")) {
                                participants.add(address);
                            }
                        }
                        break;
                    default:
                        break;
                }
            }
        }

        BodyExtractionResult body = message.getPayload() != null
                ? extractBodyFromParts(message.getPayload())
                : new BodyExtractionResult();
        String bodyText;
        if (body.plainTextContent != null && !body.plainTextContent.isBlank()) {
            bodyText = body.plainTextContent;
        } else if (body.htmlContent != null && !body.htmlContent.isBlank()) {
            bodyText = stripHtml(body.htmlContent);
        } else {
            bodyText = message.getSnippet();
        }

        Interaction interaction = new Interaction();
        interaction.setUserId(event.getUserId());
        interaction.setType(InteractionType.EMAIL);
        interaction.setSubject(ParserSupport.truncate(subject, ParserSupport.MAX_SUBJECT_LENGTH));
        interaction.setBodyText(bodyText);
        interaction.setParticipants(ParserSupport.joinParticipants(participants));
        interaction.setOccurredAt(occurredAt(event, message));
        interaction.setSource(Provider.MAIL);
        interaction.setSourceId(event.getSourceId());
        interaction.setBatchId(event.getBatchId());
        return interaction;
    }

    private static Message read(RawEvent event) {
        if (event.getPayload() == null || event.getPayload().isBlank()) {
            throw new MalformedPayloadException("Empty Gmail payload for " + event.getSourceId());
        }
        try {
            return JSON_FACTORY.fromString(event.getPayload(), Message.class);
        } catch (IOException | RuntimeException e) {
            throw new MalformedPayloadException("Unreadable Gmail payload for " + event.getSourceId() + ": " + e.getMessage(), e);
        }
    }

    private static Instant occurredAt(RawEvent event, Message message) {
        if (event.getOccurredAt() != null) {
            return event.getOccurredAt();
        }
        return message.getInternalDate() != null ? Instant.ofEpochMilli(message.getInternalDate()) : null;
    }

    private static class BodyExtractionResult {
        String htmlContent = null;
        String plainTextContent = null;
    }

    private BodyExtractionResult extractBodyFromParts(MessagePart part) {
        BodyExtractionResult result = new BodyExtractionResult();

        if (part.getBody() != null && part.getBody().getData() != null) {
            String mimeType = part.getMimeType();
            if ("text/plain".equals(mimeType) || "text/html".equals(mimeType)) {
                String decoded = decode(part.getBody().getData(), mimeType);
                if ("text/html".equals(mimeType)) {
                    result.htmlContent = decoded;
                } else {
                    result.plainTextContent = decoded;
                }
            }
        }

        if (part.getParts() != null) {
            for (MessagePart subPart : part.getParts()) {
                BodyExtractionResult subResult = extractBodyFromParts(subPart);
                if (subResult.htmlContent != null && !subResult.htmlContent.isEmpty()) {
                    result.htmlContent = (result.htmlContent != null ? result.htmlContent + "\n" : "") + subResult.htmlContent;
                }
                if (subResult.plainTextContent != null && !subResult.plainTextContent.isEmpty()) {
                    result.plainTextContent = (result.plainTextContent != null ? result.plainTextContent + "\n" : "")
                            + subResult.plainTextContent;
                }
            }
        }
        return result;
    }

    // Gmail bodies are URL-safe base64, sometimes without padding
    private static String decode(String data, String mimeType) {
        try {
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            String padded = data;
            int remainder = padded.length() % 4;
            if (remainder > 0) {
                padded += "=".repeat(4 - remainder);
            }
            try {
                return new String(Base64.getDecoder().decode(padded), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Error decoding email body part (mimeType: {}): {}", mimeType, e2.getMessage());
                return null;
            }
        }
    }

    static String stripHtml(String html) {
        String text = html
                .replaceAll("(?is)<(script|style)[^>]*>.*?</\\1>", " ")
                .replaceAll("(?i)<br\\s*/?>", "\n")
                .replaceAll("(?i)</p>", "\n")
                .replaceAll("<[^>]+>", " ")
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
        return text.replaceAll("[ \\t\\x0B\\f\\r]+", " ").replaceAll(" *\n *", "\n").trim();
    }
}
