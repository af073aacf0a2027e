package com.contextsmith.matcher.text;

import com.contextsmith.matcher.buffer.DataBlock;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class WordTokenizerTest {

    private static List<String> tokenize(WordTokenizer tokenizer, String text) {
        List<String> result = new ArrayList<>();
        for (DataBlock token : tokenizer.tokenize(DataBlock.wrap(text.getBytes(StandardCharsets.UTF_8)))) {
            result.add(token.utf8ToString());
        }
        return result;
    }

    @Test
    public void words() {
        WordTokenizer tokenizer = new WordTokenizer(TokenizationMode.WORD, (byte) ' ');
        assertEquals(Arrays.asList("a", "bc", "d"), tokenize(tokenizer, "  a bc   d "));
        assertTrue(tokenize(tokenizer, "").isEmpty());
        assertTrue(tokenize(tokenizer, "   ").isEmpty());
    }

    @Test
    public void customDelimiter() {
        WordTokenizer tokenizer = new WordTokenizer(MatcherConfiguration.defaults().setDelimiter(','));
        assertEquals(Arrays.asList("new york", "city"), tokenize(tokenizer, "new york,,city"));
    }

    @Test
    public void characters() {
        WordTokenizer tokenizer = new WordTokenizer(TokenizationMode.CHARACTER, (byte) ' ');
        assertEquals(TokenizationMode.CHARACTER, tokenizer.getMode());
        assertEquals(Arrays.asList("a", " ", "b"), tokenize(tokenizer, "a b"));
    }
}
