package com.compass.ai.agent;

import com.compass.common.dto.ClassifierResult;
import com.compass.common.exception.AiResponseFormatException;
import com.compass.common.model.Sentiment;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassifierResponseParserTest {

    private final ClassifierResponseParser parser = new ClassifierResponseParser();

    @Test
    void parsesPlainJson() {
        ClassifierResult result = parser.parse("""
                {"academics": 5, "cost": 1, "social": 4, "accommodation": 2,
                 "summary": "Great teaching but rent is very high.", "overall_sentiment": "Neutral"}
                """);

        assertThat(result.getScores().getAcademics()).isEqualTo(5);
        assertThat(result.getScores().getCost()).isEqualTo(1);
        assertThat(result.getScores().getSocial()).isEqualTo(4);
        assertThat(result.getScores().getAccommodation()).isEqualTo(2);
        assertThat(result.getSummary()).isEqualTo("Great teaching but rent is very high.");
        assertThat(result.getSentiment()).isEqualTo(Sentiment.NEUTRAL);
    }

    @Test
    void toleratesMarkdownFenceAndIntegerStrings() {
        ClassifierResult result = parser.parse("""
                Here is the analysis:
                ```json
                {"academics": "4", "cost": 3.0, "social": 4, "accommodation": 5,
                 "summary": "Friendly campus and easy housing."}
                ```
                """);

        assertThat(result.getScores().getAcademics()).isEqualTo(4);
        assertThat(result.getScores().getCost()).isEqualTo(3);
        assertThat(result.getSummary()).isEqualTo("Friendly campus and easy housing.");
    }

    @Test
    void rejectsNonCanonicalFieldNames() {
        assertThatThrownBy(() -> parser.parse("""
                {"academics_score": 4, "cost_score": 3, "social_score": 4, "accommodation_score": 5,
                 "theme_summary": "Friendly campus."}
                """)).isInstanceOf(AiResponseFormatException.class)
                .hasMessageContaining("academics");

        assertThatThrownBy(() -> parser.parse("""
                {"academics": 4, "cost": 3, "social": 4, "accommodation": 5,
                 "theme_summary": "Friendly campus."}
                """)).isInstanceOf(AiResponseFormatException.class)
                .hasMessageContaining("summary");
    }

    @Test
    void sentimentUnderAnotherKeyIsIgnored() {
        ClassifierResult result = parser.parse("""
                {"academics": 5, "cost": 5, "social": 5, "accommodation": 5,
                 "summary": "Loved it.", "sentiment": "negative"}
                """);

        assertThat(result.getSentiment()).isEqualTo(Sentiment.POSITIVE);
    }

    @Test
    void derivesSentimentFromMeanWhenAbsent() {
        ClassifierResult positive = parser.parse(
                "{\"academics\":4,\"cost\":3,\"social\":4,\"accommodation\":3,\"summary\":\"ok\"}");
        ClassifierResult negative = parser.parse(
                "{\"academics\":2,\"cost\":3,\"social\":2,\"accommodation\":3,\"summary\":\"meh\"}");
        ClassifierResult neutral = parser.parse(
                "{\"academics\":3,\"cost\":3,\"social\":3,\"accommodation\":3,\"summary\":\"fine\"}");

        assertThat(positive.getSentiment()).isEqualTo(Sentiment.POSITIVE);
        assertThat(negative.getSentiment()).isEqualTo(Sentiment.NEGATIVE);
        assertThat(neutral.getSentiment()).isEqualTo(Sentiment.NEUTRAL);
    }

    @Test
    void rejectsOutOfRangeScoreInsteadOfClamping() {
        assertThatThrownBy(() -> parser.parse(
                "{\"academics\":7,\"cost\":3,\"social\":3,\"accommodation\":3,\"summary\":\"x\"}"))
                .isInstanceOf(AiResponseFormatException.class)
                .hasMessageContaining("academics");
    }

    @Test
    void rejectsFractionalScore() {
        assertThatThrownBy(() -> parser.parse(
                "{\"academics\":3.5,\"cost\":3,\"social\":3,\"accommodation\":3,\"summary\":\"x\"}"))
                .isInstanceOf(AiResponseFormatException.class);
    }

    @Test
    void rejectsMissingFieldOrBlankSummary() {
        assertThatThrownBy(() -> parser.parse(
                "{\"academics\":3,\"cost\":3,\"social\":3,\"summary\":\"x\"}"))
                .isInstanceOf(AiResponseFormatException.class)
                .hasMessageContaining("accommodation");
        assertThatThrownBy(() -> parser.parse(
                "{\"academics\":3,\"cost\":3,\"social\":3,\"accommodation\":3,\"summary\":\"  \"}"))
                .isInstanceOf(AiResponseFormatException.class);
    }

    @Test
    void rejectsUnknownSentimentAndNonJson() {
        assertThatThrownBy(() -> parser.parse(
                "{\"academics\":3,\"cost\":3,\"social\":3,\"accommodation\":3,\"summary\":\"x\",\"overall_sentiment\":\"mixed\"}"))
                .isInstanceOf(AiResponseFormatException.class);
        assertThatThrownBy(() -> parser.parse("I cannot help with that."))
                .isInstanceOf(AiResponseFormatException.class);
    }
}
