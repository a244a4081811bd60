package com.jz.moderation.stage;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 描述文本的标签抽取与儿童关键词扫描。按词边界匹配，"son" 不会命中 "person"。
 */
@Component
public class DescriptionTagger {

    private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

    public Set<String> extractTags(String description, Collection<String> analyzerTags, List<String> vocabulary) {
        Set<String> tags = new LinkedHashSet<>();
        if (analyzerTags != null) {
            for (String t : analyzerTags) {
                if (t != null && !t.isBlank()) tags.add(t.trim().toLowerCase(Locale.ROOT));
            }
        }
        String text = normalize(description);
        for (String word : vocabulary) {
            if (containsWord(text, word)) tags.add(word);
        }
        return tags;
    }

    /** 描述中按词边界命中，或标签完全相等 */
    public List<String> findChildKeywords(String description, Set<String> tags, List<String> keywords) {
        String text = normalize(description);
        List<String> found = new ArrayList<>();
        for (String k : keywords) {
            if (containsWord(text, k) || tags.contains(k)) found.add(k);
        }
        return found;
    }

    static boolean containsWord(String text, String word) {
        if (text.isEmpty() || word == null || word.isBlank()) return false;
        return wordPattern(word).matcher(text).find();
    }

    /** 词表由配置决定，条目有限，编译结果按小写词缓存 */
    static Pattern wordPattern(String word) {
        return PATTERNS.computeIfAbsent(word.toLowerCase(Locale.ROOT),
                w -> Pattern.compile("\\b" + Pattern.quote(w) + "\\b"));
    }

    private static String normalize(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
