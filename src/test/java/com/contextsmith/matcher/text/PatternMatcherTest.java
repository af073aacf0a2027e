package com.contextsmith.matcher.text;

import com.contextsmith.matcher.ahocorasick.PatternMatch;
import com.contextsmith.matcher.ahocorasick.PatternMatches;
import com.contextsmith.matcher.buffer.DataBlock;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class PatternMatcherTest {

    private static final int NUM_LETTERS = 20;
    private static final int NUM_REPETITIONS = 9;
    private static final int MAX_PATTERN_LENGTH = 4;

    private static PatternMatcher<String> helloWorld() {
        PatternMatcher<String> matcher = new PatternMatcher<>();
        matcher.addPattern("greeting", "hello");
        matcher.addPattern("planet", "world");
        matcher.addPattern("hello-world", "hello world");
        matcher.compile();
        return matcher;
    }

    @Test
    public void findPatterns() {
        PatternMatcher<String> matcher = helloWorld();
        PatternMatches<String> matches = new PatternMatches<>(true);
        matcher.findPatterns("why hello world again", matches);
        assertEquals(Arrays.asList(new PatternMatch<>("greeting", 1),
                                   new PatternMatch<>("hello-world", 2),
                                   new PatternMatch<>("planet", 2)),
                     matches.asList());

        matches = new PatternMatches<>(false);
        matcher.findPatterns("why hello world again", matches);
        assertEquals(Arrays.asList(new PatternMatch<>("greeting", 1),
                                   new PatternMatch<>("hello-world", 2)),
                     matches.asList());
    }

    @Test
    public void repeatedDelimitersAreIgnored() {
        PatternMatches<String> matches = new PatternMatches<>(false);
        helloWorld().findPatterns("  hello   world ", matches);
        assertEquals(Arrays.asList(new PatternMatch<>("greeting", 0),
                                   new PatternMatch<>("hello-world", 1)),
                     matches.asList());
    }

    @Test
    public void unknownWordsBreakPatterns() {
        PatternMatches<String> matches = new PatternMatches<>(true);
        helloWorld().findPatterns("hello big world", matches);
        assertEquals(Arrays.asList(new PatternMatch<>("greeting", 0),
                                   new PatternMatch<>("planet", 2)),
                     matches.asList());
    }

    // Every pattern of 1 to 4 consecutive letters, wrapping around the
    // alphabet, matched against the alphabet repeated several times.
    @Test
    public void repeatedAlphabet() {
        PatternMatcher<String> matcher = new PatternMatcher<>();
        int expectedCount = 0;
        for (int first = 0; first < NUM_LETTERS; ++first) {
            for (int length = 1; length <= MAX_PATTERN_LENGTH; ++length) {
                List<String> letters = new ArrayList<>();
                for (int i = 0; i < length; ++i) {
                    letters.add(String.valueOf((char) ('a' + (first + i) % NUM_LETTERS)));
                }
                String pattern = String.join(" ", letters);
                matcher.addPattern(pattern, pattern);
                boolean wraps = first + length > NUM_LETTERS;
                expectedCount += wraps ? NUM_REPETITIONS - 1 : NUM_REPETITIONS;
            }
        }
        matcher.compile();
        assertEquals(NUM_LETTERS, matcher.getWordCount());

        StringBuilder text = new StringBuilder();
        for (int rep = 0; rep < NUM_REPETITIONS; ++rep) {
            for (int i = 0; i < NUM_LETTERS; ++i) {
                text.append((char) ('a' + i)).append(' ');
            }
        }

        PatternMatches<String> all = new PatternMatches<>(true);
        matcher.findPatterns(text.toString(), all);
        assertEquals(expectedCount, all.size());
        for (int i = 1; i < all.size(); ++i) {
            PatternMatch<String> prev = all.get(i - 1);
            PatternMatch<String> curr = all.get(i);
            assertTrue(prev.getEndPosition() <= curr.getEndPosition());
            if (prev.getEndPosition() == curr.getEndPosition()) {
                assertTrue(matcher.getPatternLength(prev.getPattern()) >
                           matcher.getPatternLength(curr.getPattern()));
            }
        }

        PatternMatches<String> longest = new PatternMatches<>(false);
        matcher.findPatterns(text.toString(), longest);
        assertEquals(NUM_LETTERS * NUM_REPETITIONS, longest.size());
        for (int i = 0; i < longest.size(); ++i) {
            assertEquals(i, longest.get(i).getEndPosition());
        }

        PatternMatches<String> completed = new PatternMatches<>(true);
        matcher.completeWithSuffixMatches(longest, completed);
        assertEquals(all.asList(), completed.asList());
    }

    @Test
    public void duplicateTextIsRejected() {
        PatternMatcher<String> matcher = new PatternMatcher<>();
        matcher.addPattern("a", "hello world");
        try {
            matcher.addPattern("b", "hello world");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        assertEquals(2, matcher.getWordCount());
        assertEquals(1, matcher.getPatternSet().size());
    }

    @Test
    public void sameWordsAreRejectedWithoutSideEffects() {
        PatternMatcher<String> matcher = new PatternMatcher<>();
        matcher.addPattern("a", "hello world");
        try {
            matcher.addPattern("b", "hello  world");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            matcher.addPattern("a", "brand new words");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        assertEquals(2, matcher.getWordCount());
        assertEquals(1, matcher.getPatternSet().size());
        assertEquals(1, matcher.getPatternLengthMap().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void blankPatternIsRejected() {
        new PatternMatcher<String>().addPattern("a", "   ");
    }

    @Test(expected = IllegalStateException.class)
    public void findPatternsRequiresCompile() {
        PatternMatcher<String> matcher = new PatternMatcher<>();
        matcher.addPattern("a", "hello");
        matcher.findPatterns("hello", new PatternMatches<>());
    }

    @Test(expected = IllegalStateException.class)
    public void addPatternAfterCompile() {
        helloWorld().addPattern("late", "late");
    }

    @Test
    public void compileIsIdempotent() {
        PatternMatcher<String> matcher = helloWorld();
        matcher.compile();
        assertTrue(matcher.isCompiled());
    }

    @Test
    public void customDelimiter() {
        MatcherConfiguration configuration = MatcherConfiguration.defaults().setDelimiter(',');
        PatternMatcher<Integer> matcher = new PatternMatcher<>(configuration);
        matcher.addPattern(1, "new york");
        matcher.addPattern(2, "new york,city");
        matcher.compile();

        PatternMatches<Integer> matches = new PatternMatches<>(true);
        matcher.findPatterns("in,new york,city", matches);
        assertEquals(Arrays.asList(new PatternMatch<>(1, 1), new PatternMatch<>(2, 2)),
                     matches.asList());
    }

    @Test
    public void characterTokenization() {
        MatcherConfiguration configuration =
            MatcherConfiguration.defaults().setTokenization(TokenizationMode.CHARACTER);
        PatternMatcher<String> matcher = new PatternMatcher<>(configuration);
        matcher.addPattern("he", "he");
        matcher.addPattern("she", "she");
        matcher.addPattern("his", "his");
        matcher.addPattern("hers", "hers");
        matcher.compile();

        PatternMatches<String> matches = new PatternMatches<>(true);
        matcher.findPatterns("ushers", matches);
        assertEquals(Arrays.asList(new PatternMatch<>("she", 3),
                                   new PatternMatch<>("he", 3),
                                   new PatternMatch<>("hers", 5)),
                     matches.asList());
        assertEquals(4, matcher.getPatternLength("hers"));
    }

    @Test
    public void patternLengthMapFollowsInsertionOrder() {
        Map<String, Integer> lengths = helloWorld().getPatternLengthMap();
        assertEquals(Arrays.asList("greeting", "planet", "hello-world"),
                     new ArrayList<>(lengths.keySet()));
        assertEquals(Integer.valueOf(2), lengths.get("hello-world"));
    }

    @Test
    public void patternSetHoldsTexts() {
        PatternMatcher<String> matcher = helloWorld();
        assertTrue(matcher.getPatternSet().contains(
            DataBlock.wrap("hello world".getBytes(StandardCharsets.UTF_8))));
        assertEquals(3, matcher.getPatternSet().size());
    }

    @Test
    public void searchIteratorEqualsFindPatterns() {
        PatternMatcher<String> matcher = helloWorld();
        String text = "hello world hello hello world";
        PatternMatches<String> expected = new PatternMatches<>(true);
        matcher.findPatterns(text, expected);

        List<PatternMatch<String>> found = new ArrayList<>();
        Iterator<PatternMatch<String>> iter = matcher.search(text, true);
        while (iter.hasNext()) found.add(iter.next());
        assertEquals(expected.asList(), found);
    }

    @Test
    public void smallBuffersAndReserve() {
        MatcherConfiguration configuration = MatcherConfiguration.defaults()
            .setBufferBlockSize(4)
            .setExpectedPatterns(2)
            .setCompactOnCompile(false);
        PatternMatcher<String> matcher = new PatternMatcher<>(configuration);
        matcher.addPattern("long", "a rather long pattern");
        matcher.addPattern("short", "long");
        matcher.compile();

        PatternMatches<String> matches = new PatternMatches<>(true);
        matcher.findPatterns("a rather long pattern", matches);
        assertEquals(Arrays.asList(new PatternMatch<>("short", 2), new PatternMatch<>("long", 3)),
                     matches.asList());
    }
}
