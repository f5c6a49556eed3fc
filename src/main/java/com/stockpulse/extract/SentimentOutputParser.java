package com.stockpulse.extract;

import com.stockpulse.core.error.MalformedOutputException;
import com.stockpulse.model.Polarity;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses and validates the model's JSON answer. Numeric scores are clamped into [0, 1];
 * a missing or unknown sentiment label, or a missing impact score, is malformed output.
 */
public final class SentimentOutputParser {
    private SentimentOutputParser() {
    }

    public static AnalysisPayload parse(String raw) throws MalformedOutputException {
        String text = stripFences(raw);
        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open < 0 || close <= open) {
            throw new MalformedOutputException("no JSON object in model output", raw);
        }
        JSONObject json;
        try {
            json = new JSONObject(text.substring(open, close + 1));
        } catch (JSONException e) {
            throw new MalformedOutputException("invalid JSON: " + e.getMessage(), raw, e);
        }

        String label = json.optString("sentiment", json.optString("polarity", ""));
        Polarity polarity = Polarity.fromLabel(label)
                .orElseThrow(() -> new MalformedOutputException("unknown sentiment label '" + label + "'", raw));

        if (!json.has("impact_score")) {
            throw new MalformedOutputException("missing impact_score", raw);
        }
        double impact = json.optDouble("impact_score", Double.NaN);
        if (Double.isNaN(impact)) {
            throw new MalformedOutputException("impact_score is not a number", raw);
        }
        double confidence = json.optDouble("confidence", 0.0);
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }

        return new AnalysisPayload(
                polarity,
                clamp01(confidence),
                clamp01(impact),
                readTags(json),
                json.optString("reasoning", "").trim()
        );
    }

    private static List<String> readTags(JSONObject json) {
        List<String> tags = new ArrayList<>();
        JSONArray array = json.optJSONArray("event_tags");
        if (array != null) {
            for (int i = 0; i < array.length(); i++) {
                String tag = array.optString(i, "").trim();
                if (!tag.isEmpty()) {
                    tags.add(tag);
                }
            }
            return tags;
        }
        String csv = json.optString("event_tags", "");
        for (String token : csv.split(",")) {
            String tag = token.trim();
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    private static String stripFences(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replace("```json", "")
                .replace("```JSON", "")
                .replace("```", "")
                .trim();
    }

    static double clamp01(double value) {
        if (value < 0.0) {
            return 0.0;
        }
        if (value > 1.0) {
            return 1.0;
        }
        return value;
    }
}
