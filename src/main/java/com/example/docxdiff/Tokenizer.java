package com.example.docxdiff;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 段落文本分词。WORD：同类字符（空白 / 单词字符 / 其他符号）的最长连续段为一个 token，空白自成 token；
 * CHAR：每个码点一个 token。所有 token 依序拼接必须等于原文。
 */
public final class Tokenizer {
    private Tokenizer() {}

    /** 惰性序列，按需切分 */
    public static Iterable<String> tokens(String text, Granularity granularity) {
        final String s = text == null ? "" : text;
        final Granularity g = granularity == null ? Granularity.WORD : granularity;
        return () -> new TokenIterator(s, g);
    }

    public static List<String> tokenize(String text, Granularity granularity) {
        List<String> out = new ArrayList<>();
        for (String t : tokens(text, granularity)) out.add(t);
        return out;
    }

    /** 数到 limit + 1 即停；用于判断是否超过单段 token 上限而不必切完整段 */
    public static int countUpTo(String text, Granularity granularity, int limit) {
        int n = 0;
        Iterator<String> it = tokens(text, granularity).iterator();
        while (it.hasNext() && n <= limit) { it.next(); n++; }
        return n;
    }

    private static int classOf(int cp) {
        if (Character.isWhitespace(cp) || Character.isSpaceChar(cp)) return 0;
        if (Character.isLetterOrDigit(cp) || cp == '_') return 1;
        return 2;
    }

    private static final class TokenIterator implements Iterator<String> {
        private final String s;
        private final Granularity g;
        private int pos;

        TokenIterator(String s, Granularity g) { this.s = s; this.g = g; }

        @Override
        public boolean hasNext() {
            return pos < s.length();
        }

        @Override
        public String next() {
            if (!hasNext()) throw new NoSuchElementException();
            int start = pos;
            int cp = s.codePointAt(pos);
            pos += Character.charCount(cp);
            if (g == Granularity.WORD) {
                int cls = classOf(cp);
                while (pos < s.length()) {
                    int nx = s.codePointAt(pos);
                    if (classOf(nx) != cls) break;
                    pos += Character.charCount(nx);
                }
            }
            return s.substring(start, pos);
        }
    }
}
