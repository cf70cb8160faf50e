package com.nevis.chunking.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word and paragraph positions inside the untouched source text.
 */
public final class TextSpans {

    private static final Pattern WORD = Pattern.compile("\\S+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+[\"'”’)\\]]*$");

    private TextSpans() {
    }

    record Word(int start, int end) {}

    /** Half-open range {@code [from, to)} of word indexes. */
    record WordRange(int from, int to) {
        int size() {
            return to - from;
        }
    }

    static List<Word> words(String text) {
        List<Word> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            words.add(new Word(matcher.start(), matcher.end()));
        }
        return words;
    }

    public static int countWords(String text) {
        int count = 0;
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * Groups words into paragraphs. A gap holding two or more line breaks separates paragraphs.
     */
    static List<WordRange> paragraphs(String text, List<Word> words) {
        List<WordRange> paragraphs = new ArrayList<>();
        int from = 0;
        for (int i = 1; i < words.size(); i++) {
            if (isParagraphGap(text, words.get(i - 1).end(), words.get(i).start())) {
                paragraphs.add(new WordRange(from, i));
                from = i;
            }
        }
        if (!words.isEmpty()) {
            paragraphs.add(new WordRange(from, words.size()));
        }
        return paragraphs;
    }

    /**
     * Marks the words after which a chunk may end cleanly: sentence ends and paragraph ends.
     */
    static boolean[] boundaries(String text, List<Word> words, List<WordRange> paragraphs) {
        boolean[] boundary = new boolean[words.size()];
        for (int i = 0; i < words.size(); i++) {
            Word word = words.get(i);
            boundary[i] = SENTENCE_END.matcher(text.substring(word.start(), word.end())).find();
        }
        for (WordRange paragraph : paragraphs) {
            boundary[paragraph.to() - 1] = true;
        }
        return boundary;
    }

    private static boolean isParagraphGap(String text, int from, int to) {
        int newlines = 0;
        for (int i = from; i < to; i++) {
            if (text.charAt(i) == '\n' && ++newlines == 2) {
                return true;
            }
        }
        return false;
    }
}
