package com.forecastsentinel.core.detection;

import com.forecastsentinel.core.error.AlignmentException;
import com.forecastsentinel.core.model.Dataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DimensionSplitter} and {@link DimensionMapping}.
 */
class DimensionSplitterTest {

    @Test
    @DisplayName("Split keeps empty parts so part counts are exact")
    void splitShouldKeepEmptyParts() {
        DimensionSplitter splitter = new DimensionSplitter(List.of("product", "platform"), "_", Map.of(), false);

        assertThat(splitter.split("producta_ios")).containsExactly("producta", "ios");
        assertThatThrownBy(() -> splitter.split("producta_ios_"))
                .isInstanceOf(AlignmentException.class)
                .hasMessageContaining("3 part(s)");
    }

    @Test
    @DisplayName("Delimiter is matched literally, not as a regex")
    void delimiterShouldBeLiteral() {
        DimensionSplitter splitter = new DimensionSplitter(List.of("a", "b"), ".", Map.of(), false);

        assertThat(splitter.split("x.y")).containsExactly("x", "y");
    }

    @Test
    @DisplayName("Labels prefer the mapping, then title-case, then the raw token")
    void labelsShouldResolveInOrder() {
        DimensionMapping products = DimensionMapping.of("product", Map.of("producta", "Product A"));

        DimensionSplitter titled = new DimensionSplitter(List.of("product", "platform"), "_",
                Map.of("product", products), true);
        DimensionSplitter raw = new DimensionSplitter(List.of("product", "platform"), "_",
                Map.of("product", products), false);

        assertThat(titled.labels("producta_ios")).containsExactly(
                Map.entry("product", "Product A"), Map.entry("platform", "Ios"));
        assertThat(raw.labels("productb_ios")).containsExactly(
                Map.entry("product", "productb"), Map.entry("platform", "ios"));
    }

    // ------------------------------------------------------------------
    // DimensionMapping
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Derived mapping keys the normalised token to the first value seen")
    void mappingShouldDeriveFromDataset() {
        Dataset actual = Dataset.builder("platform")
                .row("Mobile App")
                .row(" mobile app ")
                .row("Desktop")
                .row((Object) null)
                .build();

        DimensionMapping mapping = DimensionMapping.fromDataset(actual, "platform");

        assertThat(mapping.getLabels()).containsExactly(
                Map.entry("mobileapp", "Mobile App"), Map.entry("desktop", "Desktop"));
        assertThat(mapping.label("tablet")).isEmpty();
    }

    @Test
    @DisplayName("Overrides replace derived labels and add new ones")
    void overrideShouldMerge() {
        DimensionMapping derived = DimensionMapping.of("channel", Map.of("paid", "Paid"));

        DimensionMapping merged = derived.withOverride(Map.of("paid", "Paid Search", "organic", "Organic"));

        assertThat(merged.label("paid")).contains("Paid Search");
        assertThat(merged.label("organic")).contains("Organic");
        assertThat(derived.label("paid")).contains("Paid");
    }
}
