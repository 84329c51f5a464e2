package com.di.healthnova.insight;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TemplateRenderer Tests")
class TemplateRendererTest {

    @Test
    @DisplayName("Should fill known placeholders")
    void testRender() {
        assertEquals("More steps, higher sleep after 1 day(s)",
                TemplateRenderer.render("More {predicate}, {direction} {effect} after {lag} day(s)",
                        Map.of("predicate", "steps", "direction", "higher", "effect", "sleep", "lag", "1")));
    }

    @Test
    @DisplayName("Should leave unknown placeholders untouched")
    void testRender_Unknown() {
        assertEquals("{mystery} stays", TemplateRenderer.render("{mystery} stays", Map.of()));
    }

    @Test
    @DisplayName("Should insert values containing regex replacement characters literally")
    void testRender_SpecialCharacters() {
        assertEquals("cost $5 \\o/", TemplateRenderer.render("cost {price}", Map.of("price", "$5 \\o/")));
    }
}
