package com.sentinel.classifier.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("RuleMatcher")
class RuleMatcherTest {

    private TextNormalizer normalizer;
    private RuleMatcher matcher;
    private RuleCatalog catalog;

    @BeforeEach
    void setUp() {
        normalizer = new TextNormalizer();
        matcher = new RuleMatcher();
        catalog = RuleCatalog.builder(normalizer)
                .keywords(Category.FOOD, "coffee", "starbucks", "uber eats")
                .keywords(Category.TRANSPORT, "shell", "gas", "uber")
                .keywords(Category.RENT, "rent")
                .override("coffee and gas", Category.SHOPPING)
                .build();
    }

    private List<Candidate> match(String raw) {
        return matcher.match(normalizer.normalize(raw), catalog);
    }

    @Test
    void emptyTextYieldsNoCandidates() {
        assertThat(matcher.match(NormalizedText.EMPTY, catalog)).isEmpty();
    }

    @Test
    void overrideShortCircuitsKeywords() {
        List<Candidate> candidates = match("Coffee and GAS");

        assertThat(candidates).singleElement().satisfies(candidate -> {
            assertThat(candidate.getKind()).isEqualTo(MatchKind.OVERRIDE);
            assertThat(candidate.getCategory()).isEqualTo(Category.SHOPPING);
            assertThat(candidate.getMatchedTerm()).isEqualTo("coffee and gas");
        });
    }

    @Test
    void overrideRequiresWholeTextEquality() {
        List<Candidate> candidates = match("coffee and gas station");

        assertThat(candidates).extracting(Candidate::getKind).containsOnly(MatchKind.KEYWORD);
        assertThat(candidates).extracting(Candidate::getCategory)
                .containsExactly(Category.FOOD, Category.TRANSPORT);
    }

    @Test
    void countsDistinctKeywordsPerCategory() {
        List<Candidate> candidates = match("Shell Gas Station");

        assertThat(candidates).singleElement().satisfies(candidate -> {
            assertThat(candidate.getCategory()).isEqualTo(Category.TRANSPORT);
            assertThat(candidate.getHitCount()).isEqualTo(2);
            assertThat(candidate.getPosition()).isZero();
            assertThat(candidate.getMatchedTerm()).isEqualTo("shell");
        });
    }

    @Test
    void repeatedKeywordCountsOnce() {
        assertThat(match("coffee coffee coffee"))
                .singleElement()
                .extracting(Candidate::getHitCount)
                .isEqualTo(1);
    }

    @Test
    void recordsLeftmostPositionPerCategory() {
        List<Candidate> candidates = match("morning coffee then shell");

        assertThat(candidates).extracting(Candidate::getCategory, Candidate::getPosition)
                .containsExactly(
                        tuple(Category.FOOD, 1),
                        tuple(Category.TRANSPORT, 3));
    }

    @Test
    void keywordDoesNotMatchInsideLongerToken() {
        assertThat(match("Parent payment")).isEmpty();
        assertThat(match("Rent payment")).extracting(Candidate::getCategory).containsExactly(Category.RENT);
    }

    @Test
    void multiWordKeywordNeedsContiguousTokens() {
        List<Candidate> contiguous = match("uber eats order");
        List<Candidate> split = match("uber order eats");

        assertThat(contiguous).filteredOn(c -> c.getCategory() == Category.FOOD)
                .singleElement()
                .extracting(Candidate::getMatchedTerm)
                .isEqualTo("uber eats");
        assertThat(split).extracting(Candidate::getCategory).containsExactly(Category.TRANSPORT);
    }

    @Test
    void prefersLongerPhraseAtSamePosition() {
        RuleCatalog nested = RuleCatalog.builder(normalizer)
                .keywords(Category.FOOD, "uber", "uber eats")
                .build();

        List<Candidate> candidates = matcher.match(normalizer.normalize("Uber Eats London"), nested);

        assertThat(candidates).singleElement().satisfies(candidate -> {
            assertThat(candidate.getMatchedTerm()).isEqualTo("uber eats");
            assertThat(candidate.getHitCount()).isEqualTo(2);
        });
    }

    @Test
    void noEvidenceYieldsNoCandidates() {
        assertThat(match("XYZ123 payment")).isEmpty();
    }
}
