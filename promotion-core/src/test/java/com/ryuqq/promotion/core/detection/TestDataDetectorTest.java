package com.ryuqq.promotion.core.detection;

import com.ryuqq.promotion.core.model.Document;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.ItemId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TestDataDetector 테스트.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
class TestDataDetectorTest {

    private final TestDataDetector detector = new TestDataDetector();

    @Test
    void detects_common_test_keywords() {
        assertThat(detector.detect("This is a TEST recording")).contains("Matches test pattern: \\btest\\b");
        assertThat(detector.detect("John Doe interview")).isPresent();
        assertThat(detector.detect("Lorem ipsum dolor")).isPresent();
        assertThat(detector.detect("contact: test@test.com")).isPresent();
    }

    @Test
    void word_boundaries_avoid_false_positives() {
        assertThat(detector.detect("Contest results for quarter four")).isEmpty();
        assertThat(detector.detect("Production onboarding guide")).isEmpty();
    }

    @Test
    void null_and_blank_are_not_test_data() {
        assertThat(detector.detect(null)).isEmpty();
        assertThat(detector.detect("   ")).isEmpty();
    }

    @Test
    void inspect_reports_first_matching_field() {
        Document doc = new Document(ItemId.of("doc-1"), Environment.DEV, "Onboarding", "a dummy paragraph", "docs");

        Optional<String> reason = detector.inspect(doc);

        assertThat(reason).contains("Field 'body': Matches test pattern: \\bdummy\\b");
    }

    @Test
    void custom_patterns_replace_defaults() {
        TestDataDetector custom = new TestDataDetector(List.of("^tmp-"));

        assertThat(custom.detect("tmp-upload")).isPresent();
        assertThat(custom.detect("test upload")).isEmpty();
    }
}
