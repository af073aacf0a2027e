package com.contextsmith.matcher.text;

import java.io.IOException;
import java.util.Scanner;

import com.contextsmith.matcher.ahocorasick.PatternMatch;
import com.contextsmith.matcher.ahocorasick.PatternMatches;

/**
 * Loads a dictionary and prints the patterns found in the sentences typed
 * on the standard input.
 *
 * <pre>PatternMatcherMain &lt;dictionary&gt; [configuration.json]</pre>
 */
public class PatternMatcherMain {

  public static void interactiveRun(PatternMatcher<String> matcher) {
    Scanner scanner = new Scanner(System.in, "UTF-8");
    while (true) {
      System.out.print("Enter a sentence: ");
      if (!scanner.hasNextLine()) break;
      String text = scanner.nextLine();
      if (text.isEmpty()) continue;
      if (text.toLowerCase().equals("exit")) break;

      PatternMatches<String> matches = new PatternMatches<>(true);
      matcher.findPatterns(text, matches);
      System.out.println("Found " + matches.size() + " match(es)!");
      for (int i = 0; i < matches.size(); ++i) {
        PatternMatch<String> match = matches.get(i);
        System.out.println(String.format("%d. %s ends at word %d (%d words)",
            i + 1, match.getPattern(), match.getEndPosition(),
            matcher.getPatternLength(match.getPattern())));
      }
    }
    scanner.close();
  }

  public static void main(String[] args) throws IOException {
    if (args.length < 1) {
      System.err.println("Usage: PatternMatcherMain <dictionary> [configuration.json]");
      System.exit(-1);
    }
    MatcherConfiguration configuration = (args.length > 1) ?
        MatcherConfiguration.load(args[1]) : MatcherConfiguration.load();
    PatternMatcher<String> matcher =
        PatternMatcher.loadDictionary(args[0], configuration);
    matcher.compile();
    interactiveRun(matcher);
  }
}
