package com.my.caddy.domain.catalog;

import com.my.caddy.domain.model.IntentSuggestion;
import com.my.caddy.domain.model.IntentType;
import com.my.caddy.domain.model.Module;
import com.my.caddy.domain.model.Prerequisite;
import com.my.caddy.domain.model.RoutingTarget;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 왜: 의도별 목적지, 전제 조건, 오프라인 가능 여부, 사용자 문구를 한곳에 고정해 분류기와 라우터가 같은 정의를 공유하도록 하기 위함.
 */
public class IntentCatalog {

    private static final String DEFAULT_LIMITATION =
            "This feature needs an internet connection. You can still enter scores, check stats, or view your equipment.";

    /**
     * 오프라인 메뉴 노출 순서.
     */
    public static final List<IntentType> OFFLINE_PRIORITY = List.of(
            IntentType.SCORE_ENTRY,
            IntentType.STATS_LOOKUP,
            IntentType.EQUIPMENT_INFO,
            IntentType.PATTERN_QUERY,
            IntentType.CLUB_ADJUSTMENT,
            IntentType.ROUND_START,
            IntentType.ROUND_END,
            IntentType.SETTINGS_CHANGE,
            IntentType.HELP_REQUEST
    );

    private final Map<IntentType, IntentDefinition> definitions;

    public IntentCatalog() {
        Map<IntentType, IntentDefinition> map = new EnumMap<>(IntentType.class);
        register(map, new IntentDefinition(IntentType.CLUB_ADJUSTMENT, "Club Adjustment",
                "Adjust club distances or yardage expectations", "Adjust Club", "adjust a club distance",
                target(Module.CADDY, "club_adjustment"), List.of(Prerequisite.BAG_CONFIGURED), true, DEFAULT_LIMITATION));
        register(map, new IntentDefinition(IntentType.RECOVERY_CHECK, "Recovery Check",
                "Check recovery status and readiness", "Check Recovery", "check your recovery",
                target(Module.RECOVERY, "overview"), List.of(Prerequisite.RECOVERY_DATA), false,
                "Recovery insights need an internet connection. Check back when you're online."));
        register(map, new IntentDefinition(IntentType.SHOT_RECOMMENDATION, "Shot Recommendation",
                "Get shot advice based on current situation", "Get Shot Advice", "get shot advice",
                target(Module.CADDY, "shot_recommendation"), List.of(Prerequisite.BAG_CONFIGURED), false,
                "Shot recommendations need an internet connection. Try checking your stats or equipment instead."));
        register(map, new IntentDefinition(IntentType.SCORE_ENTRY, "Score Entry",
                "Enter or update score for a hole", "Enter Score", "enter a score",
                target(Module.CADDY, "score_entry"), List.of(Prerequisite.ROUND_ACTIVE), true, DEFAULT_LIMITATION));
        register(map, new IntentDefinition(IntentType.PATTERN_QUERY, "Pattern Query",
                "Ask about historical miss patterns or tendencies", "View Patterns", "review your miss patterns",
                null, List.of(), true, DEFAULT_LIMITATION));
        register(map, new IntentDefinition(IntentType.DRILL_REQUEST, "Drill Request",
                "Request a practice drill or training exercise", "Get Drill", "get a practice drill",
                target(Module.COACH, "drill"), List.of(), false,
                "Personalized drills need an internet connection. Check your patterns in the meantime."));
        register(map, new IntentDefinition(IntentType.WEATHER_CHECK, "Weather Check",
                "Check current or forecast weather conditions", "Check Weather", "check the weather",
                target(Module.CADDY, "weather"), List.of(), false,
                "Weather data needs an internet connection. I can't check conditions offline."));
        register(map, new IntentDefinition(IntentType.STATS_LOOKUP, "Stats Lookup",
                "Look up statistics and performance data", "View Stats", "look up your stats",
                target(Module.CADDY, "stats"), List.of(), true, DEFAULT_LIMITATION));
        register(map, new IntentDefinition(IntentType.ROUND_START, "Round Start",
                "Start a new round of golf", "Start Round", "start a new round",
                target(Module.CADDY, "round_start"), List.of(), true, DEFAULT_LIMITATION));
        register(map, new IntentDefinition(IntentType.ROUND_END, "Round End",
                "End the current round and view summary", "End Round", "end your round",
                target(Module.CADDY, "round_end"), List.of(Prerequisite.ROUND_ACTIVE), true, DEFAULT_LIMITATION));
        register(map, new IntentDefinition(IntentType.EQUIPMENT_INFO, "Equipment Info",
                "Get information about equipment and bag contents", "Equipment Info", "see your equipment",
                target(Module.SETTINGS, "equipment"), List.of(), true, DEFAULT_LIMITATION));
        register(map, new IntentDefinition(IntentType.COURSE_INFO, "Course Info",
                "Get course information and hole details", "Course Info", "see course information",
                target(Module.CADDY, "course_info"), List.of(Prerequisite.COURSE_SELECTED), false,
                "Course information needs an internet connection. Try looking at your saved rounds instead."));
        register(map, new IntentDefinition(IntentType.SETTINGS_CHANGE, "Settings Change",
                "Change app settings or preferences", "Settings", "change your settings",
                target(Module.SETTINGS, "settings"), List.of(), true, DEFAULT_LIMITATION));
        register(map, new IntentDefinition(IntentType.HELP_REQUEST, "Help Request",
                "Get help or instructions about the app", "Help", "get help",
                null, List.of(), true, DEFAULT_LIMITATION));
        register(map, new IntentDefinition(IntentType.FEEDBACK, "Feedback",
                "Provide feedback about the app", "Send Feedback", "send feedback",
                null, List.of(), false,
                "Feedback submission needs an internet connection. Your feedback will be saved and sent when you're back online."));
        register(map, new IntentDefinition(IntentType.BAILOUT_QUERY, "Bailout Query",
                "Ask where to aim for safe miss or bailout area", "Bailout Area", "find the bailout area",
                RoutingTarget.of(Module.CADDY, "live_caddy", Map.of("focus", "bailout")),
                List.of(Prerequisite.ROUND_ACTIVE), false, DEFAULT_LIMITATION));
        register(map, new IntentDefinition(IntentType.READINESS_CHECK, "Readiness Check",
                "Check readiness score and how it affects strategy", "Check Readiness", "check your readiness",
                RoutingTarget.of(Module.CADDY, "live_caddy", Map.of("focus", "readiness")),
                List.of(Prerequisite.RECOVERY_DATA), false, DEFAULT_LIMITATION));
        if (map.size() != IntentType.values().length) {
            throw new IllegalStateException("모든 의도에 정의가 필요합니다: " + map.keySet());
        }
        this.definitions = Collections.unmodifiableMap(map);
    }

    public IntentDefinition definition(IntentType type) {
        return definitions.get(type);
    }

    public List<Prerequisite> prerequisites(IntentType type) {
        return definition(type).prerequisites();
    }

    public boolean isOfflineAvailable(IntentType type) {
        return definition(type).offlineAvailable();
    }

    public IntentSuggestion suggestion(IntentType type) {
        IntentDefinition definition = definition(type);
        return new IntentSuggestion(type, definition.chipLabel(), definition.description());
    }

    /**
     * 모듈별로 알려진 화면 이름. 딥링크 검증에 쓰인다.
     */
    public Set<String> screens(Module module) {
        Set<String> screens = new TreeSet<>();
        definitions.values().stream()
                .map(IntentDefinition::destination)
                .filter(target -> target != null && target.module() == module)
                .forEach(target -> screens.add(target.screen()));
        return screens;
    }

    private static RoutingTarget target(Module module, String screen) {
        return RoutingTarget.of(module, screen, Map.of());
    }

    private static void register(Map<IntentType, IntentDefinition> map, IntentDefinition definition) {
        map.put(definition.type(), definition);
    }
}
