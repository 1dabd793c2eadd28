package io.parley.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PatternFallbackActionDetectorTest {
    private final PatternFallbackActionDetector detector = new PatternFallbackActionDetector();

    @Test
    void shouldMapCommonRequestsToActions() {
        assertThat(actionFor("How's my pipeline looking?")).isEqualTo("get_pipeline");
        assertThat(actionFor("Any hot leads today")).isEqualTo("get_hot_leads");
        assertThat(actionFor("what's on my calendar")).isEqualTo("check_calendar");
        assertThat(actionFor("Remind me to call Dana at 4")).isEqualTo("create_reminder");
        assertThat(actionFor("What should I focus on this afternoon?")).isEqualTo("get_priorities");
    }

    @Test
    void shouldCarryFixedParametersFromTable() {
        List<SuggestedAction> actions = detector.detectFallbackActions("Which deals are closing this month?");

        assertThat(actions).containsExactly(new SuggestedAction("get_deals_closing", Map.of("period", "this_month"), null));
    }

    @Test
    void shouldPassRawQueryToResearch() {
        List<SuggestedAction> actions = detector.detectFallbackActions("Research Clearwater Capital funding");

        assertThat(actions).hasSize(1);
        assertThat(actions.get(0).action()).isEqualTo(PatternFallbackActionDetector.RESEARCH);
        assertThat(actions.get(0).params()).containsEntry("query", "Research Clearwater Capital funding");
    }

    @Test
    void shouldFallBackToContactLookupWithExtractedName() {
        assertThat(detector.detectFallbackActions("Look up Dana Whitfield"))
            .containsExactly(new SuggestedAction("lookup_contact", Map.of("name", "Dana Whitfield"), null));
        assertThat(detector.detectFallbackActions("who is Sarah Chen?"))
            .containsExactly(new SuggestedAction("lookup_contact", Map.of("name", "Sarah Chen"), null));
    }

    @Test
    void shouldReturnNothingForSmallTalk() {
        assertThat(detector.detectFallbackActions("Thanks, that was helpful")).isEmpty();
        assertThat(detector.detectFallbackActions("   ")).isEmpty();
        assertThat(detector.detectFallbackActions(null)).isEmpty();
    }

    private String actionFor(String text) {
        List<SuggestedAction> actions = detector.detectFallbackActions(text);
        assertThat(actions).hasSize(1);
        return actions.get(0).action();
    }
}
