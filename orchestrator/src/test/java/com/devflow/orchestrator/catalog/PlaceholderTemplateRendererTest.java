package com.devflow.orchestrator.catalog;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PlaceholderTemplateRendererTest {

    final PlaceholderTemplateRenderer renderer = new PlaceholderTemplateRenderer();

    @Test
    void replacesKnownKeys_andToleratesInnerWhitespace() {
        String out = renderer.render("Hello {{name}}, from {{ role }}!", Map.of("name", "Ada", "role", "Architect"));

        assertThat(out).isEqualTo("Hello Ada, from Architect!");
    }

    @Test
    void unknownKeys_areLeftUntouched() {
        assertThat(renderer.render("{{known}} {{unknown}}", Map.of("known", "x")))
                .isEqualTo("x {{unknown}}");
    }

    @Test
    void replacementValues_areInsertedLiterally() {
        assertThat(renderer.render("price: {{p}}", Map.of("p", "$1 \\ 2")))
                .isEqualTo("price: $1 \\ 2");
    }

    @Test
    void nullContent_rendersEmpty() {
        assertThat(renderer.render(null, Map.of())).isEmpty();
    }
}
