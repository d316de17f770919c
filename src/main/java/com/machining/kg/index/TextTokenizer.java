package com.machining.kg.index;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits mixed Chinese/Latin text into lexical tokens.
 * <ul>
 *   <li>Latin letters and digits form word tokens; "-" and "." inside a word are kept ("t-101", "0.5mm")</li>
 *   <li>Han runs become overlapping character bigrams; a single Han character stands alone</li>
 *   <li>Question words and function words are dropped</li>
 * </ul>
 * Deterministic and stateless.
 */
public final class TextTokenizer {

    private static final Set<String> STOP_WORDS = Set.of(
            // English
            "a", "an", "the", "of", "for", "with", "and", "or", "to", "in", "on", "by", "is", "are",
            "what", "which", "how", "do", "does", "can", "all", "any", "me", "show", "list",
            // Chinese bigrams that carry no domain meaning
            "什么", "哪些", "都有", "有哪", "怎么", "如何", "请问", "可以", "一下", "是什", "么样",
            "的是", "用什", "有什", "告诉", "诉我", "我们", "你们", "需要", "应该", "使用", "一个");

    private TextTokenizer() {
    }

    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);

        int i = 0;
        int length = normalized.length();
        while (i < length) {
            int codePoint = normalized.codePointAt(i);
            if (isHan(codePoint)) {
                int end = i;
                List<String> chars = new ArrayList<>();
                while (end < length && isHan(normalized.codePointAt(end))) {
                    int cp = normalized.codePointAt(end);
                    chars.add(new String(Character.toChars(cp)));
                    end += Character.charCount(cp);
                }
                if (chars.size() == 1) {
                    add(tokens, chars.get(0));
                } else {
                    for (int c = 0; c + 1 < chars.size(); c++) {
                        add(tokens, chars.get(c) + chars.get(c + 1));
                    }
                }
                i = end;
            } else if (Character.isLetterOrDigit(codePoint)) {
                int end = i;
                while (end < length) {
                    int cp = normalized.codePointAt(end);
                    if (Character.isLetterOrDigit(cp) && !isHan(cp)) {
                        end += Character.charCount(cp);
                    } else if ((cp == '-' || cp == '.') && end + 1 < length
                            && Character.isLetterOrDigit(normalized.codePointAt(end + 1))
                            && !isHan(normalized.codePointAt(end + 1))) {
                        end++;
                    } else {
                        break;
                    }
                }
                add(tokens, normalized.substring(i, end));
                i = end;
            } else {
                i += Character.charCount(codePoint);
            }
        }
        return tokens;
    }

    private static void add(List<String> tokens, String token) {
        if (!STOP_WORDS.contains(token)) {
            tokens.add(token);
        }
    }

    private static boolean isHan(int codePoint) {
        return Character.UnicodeScript.of(codePoint) == Character.UnicodeScript.HAN;
    }
}
