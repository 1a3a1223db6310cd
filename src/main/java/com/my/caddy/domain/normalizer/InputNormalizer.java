package com.my.caddy.domain.normalizer;

import com.my.caddy.domain.model.ModificationType;
import com.my.caddy.domain.model.NormalizationResult;
import com.my.caddy.domain.model.NormalizationResult.Modification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 분류 전에 입력을 한 가지 형태로 맞춰 온라인/오프라인 분류가 같은 텍스트를 보도록 하기 위함.
 *
 * <p>순서: 소문자화, 슬랭 확장, 숫자 단어 변환(복합 먼저), 욕설 마스킹, 공백 정리. 어떤 입력에도 예외를 던지지 않는다.
 */
public class InputNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<String, String> slang;
    private final Map<String, String> compoundNumbers;
    private final Map<String, String> numberWords;
    private final Set<String> profanity;

    public InputNormalizer() {
        this(GolfSlangDictionary.slang(),
                GolfSlangDictionary.COMPOUND_NUMBERS,
                GolfSlangDictionary.NUMBER_WORDS,
                GolfSlangDictionary.PROFANITY);
    }

    public InputNormalizer(Map<String, String> slang,
                           Map<String, String> compoundNumbers,
                           Map<String, String> numberWords,
                           Set<String> profanity) {
        this.slang = slang;
        this.compoundNumbers = compoundNumbers;
        this.numberWords = numberWords;
        this.profanity = new TreeSet<>(profanity);
    }

    public NormalizationResult normalize(String input) {
        if (input == null) {
            return NormalizationResult.unchanged("");
        }
        if (input.isBlank()) {
            return NormalizationResult.unchanged(input);
        }
        List<Modification> modifications = new ArrayList<>();

        String text = input.toLowerCase(Locale.ROOT);
        if (!text.equals(input)) {
            modifications.add(new Modification(ModificationType.CASE, input, text));
        }
        text = replaceWords(text, slang, ModificationType.SLANG, modifications);
        text = replaceWords(text, compoundNumbers, ModificationType.NUMBER, modifications);
        text = replaceWords(text, numberWords, ModificationType.NUMBER, modifications);
        text = maskProfanity(text, modifications);
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();

        return new NormalizationResult(input, text, modifications);
    }

    private static String replaceWords(String text,
                                       Map<String, String> table,
                                       ModificationType type,
                                       List<Modification> modifications) {
        String result = text;
        for (Map.Entry<String, String> entry : table.entrySet()) {
            Matcher matcher = wordPattern(entry.getKey()).matcher(result);
            if (!matcher.find()) {
                continue;
            }
            do {
                modifications.add(new Modification(type, matcher.group(), entry.getValue()));
            } while (matcher.find());
            result = matcher.replaceAll(Matcher.quoteReplacement(entry.getValue()));
        }
        return result;
    }

    private String maskProfanity(String text, List<Modification> modifications) {
        String result = text;
        for (String word : profanity) {
            Matcher matcher = wordPattern(word).matcher(result);
            if (!matcher.find()) {
                continue;
            }
            String mask = "*".repeat(word.length());
            do {
                modifications.add(new Modification(ModificationType.PROFANITY, matcher.group(), mask));
            } while (matcher.find());
            result = matcher.replaceAll(mask);
        }
        return result;
    }

    private static Pattern wordPattern(String phrase) {
        // 하이픈으로 붙은 토큰("7-iron")의 일부는 건드리지 않는다.
        return Pattern.compile("(?<![\\w-])" + Pattern.quote(phrase) + "(?![\\w-])");
    }
}
