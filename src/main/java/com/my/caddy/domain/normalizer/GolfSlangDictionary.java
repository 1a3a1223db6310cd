package com.my.caddy.domain.normalizer;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 왜: 골프 약어와 숫자 표현을 한곳에 고정해 정규화 결과가 항상 같은 사전을 따르도록 하기 위함.
 *
 * <p>한 글자 약어(예: "d")와 라이 이름("bunker")은 일반 단어나 엔티티 추출을 깨뜨리므로 넣지 않는다.
 */
public final class GolfSlangDictionary {

    public static final Map<String, String> CLUB_ABBREVIATIONS = longestFirst(Map.ofEntries(
            Map.entry("3i", "3-iron"),
            Map.entry("4i", "4-iron"),
            Map.entry("5i", "5-iron"),
            Map.entry("6i", "6-iron"),
            Map.entry("7i", "7-iron"),
            Map.entry("8i", "8-iron"),
            Map.entry("9i", "9-iron"),
            Map.entry("pw", "pitching wedge"),
            Map.entry("gw", "gap wedge"),
            Map.entry("aw", "approach wedge"),
            Map.entry("sw", "sand wedge"),
            Map.entry("lw", "lob wedge"),
            Map.entry("3w", "3-wood"),
            Map.entry("5w", "5-wood"),
            Map.entry("7w", "7-wood"),
            Map.entry("2h", "2-hybrid"),
            Map.entry("3h", "3-hybrid"),
            Map.entry("4h", "4-hybrid"),
            Map.entry("5h", "5-hybrid")
    ));

    public static final Map<String, String> COMMON_TERMS = longestFirst(Map.ofEntries(
            Map.entry("stick", "club"),
            Map.entry("sticks", "clubs"),
            Map.entry("dance floor", "green"),
            Map.entry("the dance floor", "green"),
            Map.entry("tin cup", "hole"),
            Map.entry("putting surface", "green"),
            Map.entry("fairway metal", "fairway wood"),
            Map.entry("big stick", "driver"),
            Map.entry("big dog", "driver"),
            Map.entry("flat stick", "putter")
    ));

    public static final Map<String, String> COMPOUND_NUMBERS = longestFirst(Map.ofEntries(
            Map.entry("one hundred fifty", "150"),
            Map.entry("one hundred sixty", "160"),
            Map.entry("one hundred seventy", "170"),
            Map.entry("one hundred eighty", "180"),
            Map.entry("one hundred ninety", "190"),
            Map.entry("two hundred", "200"),
            Map.entry("one ten", "110"),
            Map.entry("one twenty", "120"),
            Map.entry("one thirty", "130"),
            Map.entry("one forty", "140"),
            Map.entry("one fifty", "150"),
            Map.entry("one sixty", "160"),
            Map.entry("one seventy", "170"),
            Map.entry("one eighty", "180"),
            Map.entry("one ninety", "190"),
            Map.entry("twenty one", "21"),
            Map.entry("twenty two", "22"),
            Map.entry("twenty three", "23"),
            Map.entry("twenty four", "24"),
            Map.entry("twenty five", "25"),
            Map.entry("twenty six", "26"),
            Map.entry("twenty seven", "27"),
            Map.entry("twenty eight", "28"),
            Map.entry("twenty nine", "29"),
            Map.entry("thirty one", "31"),
            Map.entry("thirty two", "32"),
            Map.entry("thirty three", "33"),
            Map.entry("thirty four", "34"),
            Map.entry("thirty five", "35"),
            Map.entry("thirty six", "36"),
            Map.entry("thirty seven", "37"),
            Map.entry("thirty eight", "38"),
            Map.entry("thirty nine", "39"),
            Map.entry("three iron", "3-iron"),
            Map.entry("four iron", "4-iron"),
            Map.entry("five iron", "5-iron"),
            Map.entry("six iron", "6-iron"),
            Map.entry("seven iron", "7-iron"),
            Map.entry("eight iron", "8-iron"),
            Map.entry("nine iron", "9-iron"),
            Map.entry("three wood", "3-wood"),
            Map.entry("five wood", "5-wood"),
            Map.entry("seven wood", "7-wood")
    ));

    public static final Map<String, String> NUMBER_WORDS = longestFirst(Map.ofEntries(
            Map.entry("one", "1"),
            Map.entry("two", "2"),
            Map.entry("three", "3"),
            Map.entry("four", "4"),
            Map.entry("five", "5"),
            Map.entry("six", "6"),
            Map.entry("seven", "7"),
            Map.entry("eight", "8"),
            Map.entry("nine", "9"),
            Map.entry("ten", "10"),
            Map.entry("eleven", "11"),
            Map.entry("twelve", "12"),
            Map.entry("thirteen", "13"),
            Map.entry("fourteen", "14"),
            Map.entry("fifteen", "15"),
            Map.entry("sixteen", "16"),
            Map.entry("seventeen", "17"),
            Map.entry("eighteen", "18"),
            Map.entry("nineteen", "19"),
            Map.entry("twenty", "20"),
            Map.entry("thirty", "30"),
            Map.entry("forty", "40"),
            Map.entry("fifty", "50"),
            Map.entry("sixty", "60"),
            Map.entry("seventy", "70"),
            Map.entry("eighty", "80"),
            Map.entry("ninety", "90"),
            Map.entry("hundred", "100")
    ));

    public static final Set<String> PROFANITY = Set.of(
            "fuck", "shit", "damn", "hell", "ass", "bitch",
            "crap", "piss", "bastard", "cock", "dick"
    );

    private GolfSlangDictionary() {
    }

    public static Map<String, String> slang() {
        Map<String, String> all = new LinkedHashMap<>(CLUB_ABBREVIATIONS);
        all.putAll(COMMON_TERMS);
        return longestFirst(all);
    }

    /**
     * 긴 표현을 먼저 적용해야 "the dance floor"가 "dance floor"보다 우선한다. 길이가 같으면 사전순.
     */
    private static Map<String, String> longestFirst(Map<String, String> source) {
        List<Map.Entry<String, String>> entries = source.entrySet().stream()
                .sorted(Comparator.<Map.Entry<String, String>>comparingInt(entry -> entry.getKey().length())
                        .reversed()
                        .thenComparing(Map.Entry::getKey))
                .toList();
        Map<String, String> ordered = new LinkedHashMap<>();
        entries.forEach(entry -> ordered.put(entry.getKey(), entry.getValue()));
        return java.util.Collections.unmodifiableMap(ordered);
    }
}
