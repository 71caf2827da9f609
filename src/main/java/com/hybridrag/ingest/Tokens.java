package com.hybridrag.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Tokens {
    private static final Pattern TOKEN = Pattern.compile("\\S+");

    private Tokens() {
    }

    public static int count(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        Matcher matcher = TOKEN.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    public static List<int[]> spans(String text) {
        List<int[]> spans = new ArrayList<>();
        if (text == null) {
            return spans;
        }
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            spans.add(new int[] { matcher.start(), matcher.end() });
        }
        return spans;
    }

    public static String[] splitAfter(String text, int headTokens) {
        List<int[]> spans = spans(text);
        if (headTokens <= 0) {
            return new String[] { "", text.strip() };
        }
        if (headTokens >= spans.size()) {
            return new String[] { text.strip(), "" };
        }
        int headEnd = spans.get(headTokens - 1)[1];
        int tailStart = spans.get(headTokens)[0];
        return new String[] { text.substring(spans.get(0)[0], headEnd), text.substring(tailStart).strip() };
    }

    static String slice(String text, List<int[]> spans, int fromToken, int toTokenExclusive) {
        return text.substring(spans.get(fromToken)[0], spans.get(toTokenExclusive - 1)[1]);
    }
}
