package dev.mealplans.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.mealplans.model.DraftResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a draft generator's free-text response into a plan. Only the shape is checked
 * here (a JSON object with exactly three days); content is left to the validator.
 */
public final class DraftParser {

    private static final Logger log = LoggerFactory.getLogger(DraftParser.class);

    public static final int REQUIRED_DAYS = 3;

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .build();
    private static final Pattern FENCED_BLOCK = Pattern.compile("```json\\s*(\\{.*?\\})\\s*```", Pattern.DOTALL);
    private static final Pattern BRACED_SPAN = Pattern.compile("(\\{.*\\})", Pattern.DOTALL);
    private static final Pattern BARE_KEY = Pattern.compile("([{,]\\s*)([A-Za-z0-9_]+)(\\s*:\\s*)");

    private DraftParser() {}

    public static DraftResult parse(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return new DraftResult.Failure("Empty draft response", responseText);
        }

        Optional<JsonNode> extracted = extractJson(responseText);
        if (extracted.isEmpty()) {
            return new DraftResult.Failure("No valid JSON object found in draft response", responseText);
        }
        JsonNode root = extracted.get();

        JsonNode days = root.get("days");
        if (days == null || !days.isArray()) {
            return new DraftResult.Failure("Draft is missing the 'days' list", responseText);
        }
        if (days.size() != REQUIRED_DAYS) {
            return new DraftResult.Failure(
                "Draft must have exactly %d days, found %d".formatted(REQUIRED_DAYS, days.size()), responseText);
        }
        for (int i = 0; i < days.size(); i++) {
            if (!days.get(i).isObject()) {
                return new DraftResult.Failure("Draft day %d is not an object".formatted(i + 1), responseText);
            }
        }

        try {
            return new DraftResult.Success(PlanCodec.fromJson(root));
        } catch (RuntimeException e) {
            return new DraftResult.Failure("Draft does not match the plan shape: " + e.getMessage(), responseText);
        }
    }

    /**
     * Find the first JSON object in the text: the whole text, a ```json fenced block,
     * the outermost brace span, and finally that span with bare keys quoted.
     */
    static Optional<JsonNode> extractJson(String text) {
        String trimmed = text.trim();
        Optional<JsonNode> direct = readObject(trimmed);
        if (direct.isPresent()) {
            return direct;
        }

        Matcher fenced = FENCED_BLOCK.matcher(trimmed);
        if (fenced.find()) {
            Optional<JsonNode> node = readObject(fenced.group(1));
            if (node.isPresent()) {
                return node;
            }
            log.debug("JSON in fenced block could not be parsed");
        }

        Matcher braced = BRACED_SPAN.matcher(trimmed);
        if (braced.find()) {
            String candidate = braced.group(1);
            Optional<JsonNode> node = readObject(candidate);
            if (node.isPresent()) {
                return node;
            }
            log.debug("Brace span could not be parsed, quoting bare keys");
            return readObject(BARE_KEY.matcher(candidate).replaceAll("$1\"$2\"$3"));
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> readObject(String candidate) {
        try {
            JsonNode node = MAPPER.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.trace("Candidate is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
