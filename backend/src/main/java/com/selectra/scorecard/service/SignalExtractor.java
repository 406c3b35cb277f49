package com.selectra.scorecard.service;

import com.selectra.scorecard.model.QuestionSpec;
import com.selectra.scorecard.model.Signals;
import com.selectra.scorecard.rubric.Rubric;
import com.selectra.scorecard.rubric.Scores;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns raw answer text into {@link Signals}. Stateless apart from the
 * precompiled phrase patterns, so a single instance is shared across requests.
 */
@Service
public class SignalExtractor {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+\\z", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SENTENCE_DELIMITERS = Pattern.compile("[.!?]+");
    private static final String VOWELS = "aeiouAEIOU";

    static final double GIBBERISH_REAL_WORD_RATIO = 0.4;
    static final double SHORT_ANSWER_REAL_WORD_RATIO = 0.6;
    static final int SHORT_ANSWER_WORDS = 15;

    private final Map<String, Pattern> fillerPatterns = new LinkedHashMap<>();
    private final List<String> assertivePhrases;
    private final List<String> examplePhrases;

    public SignalExtractor(Rubric rubric) {
        for (String filler : rubric.getFillerPhrases()) {
            fillerPatterns.put(filler, Pattern.compile(
                    "\\b" + Pattern.quote(filler.toLowerCase(Locale.ROOT)) + "\\b",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS));
        }
        this.assertivePhrases = lowerCase(rubric.getAssertivePhrases());
        this.examplePhrases = lowerCase(rubric.getExamplePhrases());
    }

    public Signals extract(String answer, QuestionSpec question) {
        String text = trim(answer);
        String lower = text.toLowerCase(Locale.ROOT);

        String[] words = text.isEmpty() ? new String[0] : WHITESPACE.split(text);
        int wordCount = words.length;
        int sentenceCount = countSentences(text);

        Set<String> uniqueWords = new HashSet<>();
        for (String word : words) {
            uniqueWords.add(word.toLowerCase(Locale.ROOT));
        }
        double uniqueRatio = Scores.ratio(uniqueWords.size(), wordCount);

        List<String> keywords = question.getKeywords();
        List<String> matchedKeywords = keywords.stream()
                .filter(kw -> lower.contains(kw.toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());
        double keywordMatchRatio = Scores.ratio(matchedKeywords.size(), keywords.size());

        List<String> fillerWordsFound = new ArrayList<>();
        int fillerCount = 0;
        for (Map.Entry<String, Pattern> entry : fillerPatterns.entrySet()) {
            Matcher matcher = entry.getValue().matcher(lower);
            int hits = 0;
            while (matcher.find()) {
                hits++;
            }
            if (hits > 0) {
                fillerCount += hits;
                fillerWordsFound.add(entry.getKey());
            }
        }

        List<String> assertiveFound = assertivePhrases.stream()
                .filter(lower::contains)
                .collect(Collectors.toList());
        boolean hasExamples = examplePhrases.stream().anyMatch(lower::contains);

        boolean startsWithCapital = !text.isEmpty() && isUpperCaseInvariant(text.codePointAt(0));

        int avgSentenceLen = sentenceCount > 0
                ? Scores.roundToInt((double) wordCount / sentenceCount)
                : wordCount;

        long realWords = Arrays.stream(words).filter(SignalExtractor::isRealWord).count();
        double realWordRatio = Scores.ratio((int) realWords, wordCount);

        boolean gibberish = realWordRatio < GIBBERISH_REAL_WORD_RATIO
                || (wordCount > 0
                && keywordMatchRatio == 0
                && realWordRatio < SHORT_ANSWER_REAL_WORD_RATIO
                && wordCount < SHORT_ANSWER_WORDS);

        return Signals.builder()
                .wordCount(wordCount)
                .sentenceCount(sentenceCount)
                .uniqueRatio(uniqueRatio)
                .matchedKeywords(List.copyOf(matchedKeywords))
                .totalKeywords(keywords.size())
                .keywordMatchRatio(keywordMatchRatio)
                .fillerWordsFound(List.copyOf(fillerWordsFound))
                .fillerCount(fillerCount)
                .assertiveFound(List.copyOf(assertiveFound))
                .hasExamples(hasExamples)
                .startsWithCapital(startsWithCapital)
                .avgSentenceLen(avgSentenceLen)
                .realWordRatio(realWordRatio)
                .gibberish(gibberish)
                .build();
    }

    private static int countSentences(String text) {
        int count = 0;
        for (String fragment : SENTENCE_DELIMITERS.split(text)) {
            if (!trim(fragment).isEmpty()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Strips leading and trailing Unicode white space, including no-break
     * spaces, using the same class that separates words.
     */
    public static String trim(String answer) {
        return answer == null ? "" : EDGE_WHITESPACE.matcher(answer).replaceAll("");
    }

    // digits and punctuation count; "ß" upper-cases to "SS" and does not
    static boolean isUpperCaseInvariant(int codePoint) {
        String first = new String(Character.toChars(codePoint));
        return first.equals(first.toUpperCase(Locale.ROOT));
    }

    // three or more characters with at least one vowel
    static boolean isRealWord(String word) {
        if (word.length() < 3) {
            return false;
        }
        for (int i = 0; i < word.length(); i++) {
            if (VOWELS.indexOf(word.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static List<String> lowerCase(List<String> phrases) {
        return phrases.stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }
}
