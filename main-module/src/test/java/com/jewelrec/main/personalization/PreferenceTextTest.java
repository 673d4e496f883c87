package com.jewelrec.main.personalization;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PreferenceTextTest {

    @Test
    void rendersAllKnownKeys() {
        Map<String, Object> preferences = new LinkedHashMap<>();
        preferences.put("diamond_shape", "oval");
        preferences.put("metal", "rose gold");
        preferences.put("price_range", List.of(1000.0, 5000.0));
        preferences.put("style", "vintage");
        preferences.put("diamond_color", "D-F");
        preferences.put("budget_hint", "ignored");

        assertThat(PreferenceText.render(preferences)).isEqualTo(
            "prefers rose gold. prefers vintage style. price range $1000 to $5000. "
                + "prefers D-F color diamonds. prefers oval shape");
    }

    @Test
    void emptyPreferences() {
        assertThat(PreferenceText.render(Map.of())).isEqualTo("no specific preferences");
        assertThat(PreferenceText.render(Map.of("price_range", List.of(1)))).isEqualTo("no specific preferences");
    }
}
