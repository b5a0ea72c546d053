package com.example.harborwatch.classification;

import com.example.harborwatch.model.BoundingBox;
import com.example.harborwatch.model.Classification;
import com.example.harborwatch.model.ColorHint;
import com.example.harborwatch.model.Detection;
import com.example.harborwatch.model.GeoPoint;
import com.example.harborwatch.model.MatchResult;
import com.example.harborwatch.model.RegistryEntry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClassificationPolicyTest {

    private static final Detection DETECTION = new Detection("det-1", new BoundingBox(10, 10, 30, 30));
    private static final GeoPoint POSITION = new GeoPoint(31.1925, 29.8605);

    private final ClassificationPolicy policy = new ClassificationPolicy();

    @Test
    void legalMatchIsLabelledWithVesselName() {
        MatchResult result = MatchResult.legal(DETECTION, POSITION, new RegistryEntry("1", "ALEX STAR", POSITION), 0.0);

        Classification classification = policy.classify(result);

        assertThat(classification.label()).isEqualTo("ALEX STAR");
        assertThat(classification.colorHint()).isEqualTo(ColorHint.GREEN);
    }

    @Test
    void legalMatchWithoutNameIsLabelledUnknown() {
        MatchResult unnamed = MatchResult.legal(DETECTION, POSITION, new RegistryEntry("1", null, POSITION), 3.5);
        MatchResult blank = MatchResult.legal(DETECTION, POSITION, new RegistryEntry("2", "  ", POSITION), 3.5);

        assertThat(policy.classify(unnamed).label()).isEqualTo(ClassificationPolicy.UNNAMED_LABEL);
        assertThat(policy.classify(blank).label()).isEqualTo("UNKNOWN");
        assertThat(policy.classify(unnamed).colorHint()).isEqualTo(ColorHint.GREEN);
    }

    @Test
    void darkResultIsLabelledDarkShipInRed() {
        Classification classification = policy.classify(MatchResult.dark(DETECTION, POSITION));

        assertThat(classification.label()).isEqualTo("DARK SHIP");
        assertThat(classification.colorHint()).isEqualTo(ColorHint.RED);
    }
}
