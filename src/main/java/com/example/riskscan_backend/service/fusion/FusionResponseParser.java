package com.example.riskscan_backend.service.fusion;

import com.example.riskscan_backend.util.Modality;
import com.example.riskscan_backend.util.RiskClassification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.*;

/**
 * Validates a reasoning reply against the assessment schema. Nothing is defaulted: any missing or
 * malformed field is reported as a violation.
 */
@Component
public class FusionResponseParser {
    private static final BigDecimal MAX_SCORE = BigDecimal.valueOf(100);

    public record Draft(int score, String proposedClassification, String narrative, List<String> citedWindows) {}

    /** Exactly one of {@code draft} and a non-empty {@code violations} is set. */
    public record Outcome(Draft draft, List<String> violations) {
        public boolean valid() {
            return draft != null;
        }
    }

    private final ObjectMapper om;

    public FusionResponseParser(ObjectMapper om) {
        this.om = om;
    }

    /**
     * @param windowOrder known window ids in timeline order; cited ids are returned in this order.
     * @param missing     modalities the narrative must name.
     */
    public Outcome parse(String raw, List<String> windowOrder, List<Modality> missing) {
        List<String> violations = new ArrayList<>();
        JsonNode root;
        try {
            root = om.readTree(stripFences(raw));
        } catch (JsonProcessingException e) {
            return new Outcome(null, List.of("reply is not valid JSON: " + e.getOriginalMessage()));
        }
        if (root == null || !root.isObject()) {
            return new Outcome(null, List.of("reply must be a JSON object"));
        }

        Integer score = null;
        JsonNode s = root.get("score");
        if (s == null || s.isNull()) {
            violations.add("\"score\" is required");
        } else if (!s.isNumber() || !isIntegral(s)) {
            violations.add("\"score\" must be an integer number, got " + s);
        } else if (s.decimalValue().compareTo(BigDecimal.ZERO) < 0 || s.decimalValue().compareTo(MAX_SCORE) > 0) {
            violations.add("\"score\" must be between 0 and 100, got " + s);
        } else {
            score = s.asInt();
        }

        String label = root.path("classification").asText(null);
        if (label == null || !isLabel(label)) {
            violations.add("\"classification\" must be one of LOW, MEDIUM, HIGH");
        }

        String narrative = root.path("narrative").isTextual() ? root.path("narrative").asText().trim() : null;
        if (narrative == null || narrative.isEmpty()) {
            violations.add("\"narrative\" must be a non-empty string");
        } else {
            for (Modality m : missing) {
                if (!m.isNamedIn(narrative)) {
                    violations.add("\"narrative\" must state that the " + m.key() + " analysis was unavailable");
                }
            }
        }

        List<String> cited = new ArrayList<>();
        JsonNode c = root.get("citedWindows");
        if (c == null || !c.isArray()) {
            violations.add("\"citedWindows\" must be an array of window ids");
        } else {
            Set<String> seen = new HashSet<>();
            for (JsonNode id : c) {
                String v = id.isTextual() ? id.asText().trim() : null;
                if (v == null || !windowOrder.contains(v)) {
                    violations.add("\"citedWindows\" contains unknown window " + id);
                } else {
                    seen.add(v);
                }
            }
            if (seen.isEmpty() && !windowOrder.isEmpty()) {
                violations.add("\"citedWindows\" must cite at least one window");
            }
            for (String w : windowOrder) {
                if (seen.contains(w)) cited.add(w);
            }
        }

        if (!violations.isEmpty()) {
            return new Outcome(null, List.copyOf(violations));
        }
        return new Outcome(new Draft(score, label.trim().toUpperCase(Locale.ROOT), narrative, List.copyOf(cited)), List.of());
    }

    static String stripFences(String raw) {
        if (raw == null) {
            return "";
        }
        String s = raw.trim();
        if (s.startsWith("```")) {
            int nl = s.indexOf('\n');
            s = nl >= 0 ? s.substring(nl + 1) : s.substring(3);
        }
        s = s.trim();
        if (s.endsWith("```")) {
            s = s.substring(0, s.length() - 3);
        }
        return s.trim();
    }

    private static boolean isIntegral(JsonNode n) {
        if (n.isIntegralNumber()) {
            return true;
        }
        double d = n.asDouble();
        return !Double.isInfinite(d) && d == Math.rint(d);
    }

    private static boolean isLabel(String label) {
        String u = label.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(RiskClassification.values()).anyMatch(c -> c.name().equals(u));
    }
}
