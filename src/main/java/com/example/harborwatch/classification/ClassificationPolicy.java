package com.example.harborwatch.classification;

import com.example.harborwatch.model.Classification;
import com.example.harborwatch.model.ColorHint;
import com.example.harborwatch.model.MatchResult;
import com.example.harborwatch.model.MatchStatus;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Maps a correlation outcome to the label and colour shown by map and image
 * overlays. A new status only needs a new branch here; the correlation engine
 * stays untouched.
 */
@Component
public class ClassificationPolicy {

    public static final String DARK_LABEL = "DARK SHIP";
    public static final String UNNAMED_LABEL = "UNKNOWN";

    public Classification classify(MatchResult result) {
        Objects.requireNonNull(result, "result");
        if (result.status() == MatchStatus.LEGAL) {
            return new Classification(legalLabel(result), ColorHint.GREEN);
        }
        return new Classification(DARK_LABEL, ColorHint.RED);
    }

    private String legalLabel(MatchResult result) {
        String name = result.matchedEntry().name();
        return name == null || name.isBlank() ? UNNAMED_LABEL : name;
    }
}
