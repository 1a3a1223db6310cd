package com.my.caddy.domain.normalizer;

import com.my.caddy.domain.model.Entities;
import com.my.caddy.domain.model.Lie;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: LLM 없이도 정규화된 텍스트에서 홀/클럽/거리/스코어/라이를 결정적으로 뽑아 오프라인 경로와 LLM 누락값을 채우기 위함.
 *
 * <p>찾지 못하거나 범위를 벗어난 값은 비워 둔다.
 */
public class EntityExtractor {

    private static final Pattern HOLE = Pattern.compile("\\bhole\\s+(?:number\\s+)?#?(\\d{1,2})\\b");
    private static final Pattern YARDAGE = Pattern.compile("\\b(\\d{1,3})\\s*(?:yards?|yds?)\\b");
    private static final Pattern SCORE = Pattern.compile(
            "\\b(?:(?:score(?:d)?|made|got|took)\\s+(?:an?\\s+|of\\s+)?|shot\\s+an?\\s+)(\\d{1,2})(?![\\w-])");
    private static final Pattern NUMBERED_CLUB = Pattern.compile("\\b([2-9])-(iron|wood|hybrid)\\b");
    private static final Pattern NAMED_CLUB =
            Pattern.compile("\\b(driver|putter|(?:pitching|gap|approach|sand|lob) wedge)\\b");

    private static final Map<String, Lie> LIE_KEYWORDS = new LinkedHashMap<>();

    static {
        LIE_KEYWORDS.put("tee box", Lie.TEE);
        LIE_KEYWORDS.put("fairway", Lie.FAIRWAY);
        LIE_KEYWORDS.put("rough", Lie.ROUGH);
        LIE_KEYWORDS.put("bunker", Lie.BUNKER);
        LIE_KEYWORDS.put("sand trap", Lie.BUNKER);
        LIE_KEYWORDS.put("fringe", Lie.FRINGE);
        LIE_KEYWORDS.put("green", Lie.GREEN);
        LIE_KEYWORDS.put("hazard", Lie.HAZARD);
        LIE_KEYWORDS.put("water", Lie.HAZARD);
    }

    public Entities extract(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) {
            return Entities.empty();
        }
        return new Entities(
                club(normalizedText).orElse(null),
                firstNumber(SCORE, normalizedText),
                firstNumber(HOLE, normalizedText),
                firstNumber(YARDAGE, normalizedText),
                lie(normalizedText).orElse(null)
        );
    }

    private static Optional<String> club(String text) {
        Matcher numbered = NUMBERED_CLUB.matcher(text);
        if (numbered.find()) {
            return Optional.of(numbered.group(1) + "-" + numbered.group(2));
        }
        Matcher named = NAMED_CLUB.matcher(text);
        if (named.find()) {
            return Optional.of(named.group(1));
        }
        return Optional.empty();
    }

    // "fairway wood"는 라이가 아니라 클럽이다.
    private static Optional<Lie> lie(String text) {
        String withoutClubs = text.replace("fairway wood", "");
        return LIE_KEYWORDS.entrySet().stream()
                .filter(entry -> Pattern.compile("\\b" + Pattern.quote(entry.getKey()) + "\\b").matcher(withoutClubs).find())
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private static Integer firstNumber(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return Integer.valueOf(matcher.group(1));
    }
}
