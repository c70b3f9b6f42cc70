package com.compass.ai.prompt;

import com.compass.common.model.Language;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptTemplatesTest {

    private PromptTemplates templates;

    @BeforeEach
    void setUp() {
        templates = new PromptTemplates();
        templates.loadPrompts();
    }

    @Test
    void classificationPromptCarriesTextAndLanguageHint() {
        String prompt = templates.renderClassification("الجامعة جيدة لكن السكن صعب", Language.AR);

        assertThat(prompt)
                .contains("الجامعة جيدة لكن السكن صعب")
                .contains("detected language: ar")
                .doesNotContain("{text}")
                .doesNotContain("{language_hint}");
    }

    @Test
    void summaryPromptListsOneReviewPerLine() {
        String prompt = templates.renderUniversitySummary("LMU Munich", List.of("Great lectures", "Rent is\nhigh"));

        assertThat(prompt)
                .contains("LMU Munich")
                .contains("- Great lectures\n")
                .contains("- Rent is high\n")
                .doesNotContain("{reviews}");
    }
}
