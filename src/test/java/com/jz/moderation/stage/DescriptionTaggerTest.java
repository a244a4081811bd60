package com.jz.moderation.stage;

import com.jz.moderation.config.ModerationSettings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DescriptionTaggerTest {

    private final DescriptionTagger tagger = new DescriptionTagger();

    @Test
    void extractsVocabularyTags_inLowerCase() {
        Set<String> tags = tagger.extractTags("A Woman in a Bikini on the beach", List.of("Summer"),
                ModerationSettings.DEFAULT_TAG_VOCABULARY);
        assertEquals(List.of("summer", "woman", "beach", "bikini"), List.copyOf(tags));
    }

    @Test
    void childKeywords_matchOnWordBoundaries() {
        List<String> found = tagger.findChildKeywords("a person standing next to a mason jar", Set.of(),
                ModerationSettings.DEFAULT_CHILD_KEYWORDS);
        assertTrue(found.isEmpty(), "son must not match person or mason");

        List<String> hits = tagger.findChildKeywords("a girl and her son at the playground", Set.of(),
                ModerationSettings.DEFAULT_CHILD_KEYWORDS);
        assertEquals(List.of("girl", "son", "playground"), hits);
    }

    @Test
    void childKeywords_matchTagsExactly() {
        List<String> hits = tagger.findChildKeywords("outdoor scene", Set.of("toddler"),
                ModerationSettings.DEFAULT_CHILD_KEYWORDS);
        assertEquals(List.of("toddler"), hits);
    }

    @Test
    void wordPatterns_areCompiledOncePerWord() {
        assertSame(DescriptionTagger.wordPattern("kid"), DescriptionTagger.wordPattern("kid"));
        assertSame(DescriptionTagger.wordPattern("kid"), DescriptionTagger.wordPattern("KID"));
        assertNotSame(DescriptionTagger.wordPattern("kid"), DescriptionTagger.wordPattern("kids"));

        for (int i = 0; i < 3; i++) {
            assertEquals(List.of("kid"), tagger.findChildKeywords("a kid reading", Set.of(), List.of("kid", "kids")));
        }
    }

    @Test
    void emptyDescription_hasNoMatches() {
        assertFalse(DescriptionTagger.containsWord("", "child"));
        assertTrue(tagger.extractTags(null, null, ModerationSettings.DEFAULT_TAG_VOCABULARY).isEmpty());
    }
}
