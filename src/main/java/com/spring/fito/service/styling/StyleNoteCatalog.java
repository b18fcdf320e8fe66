package com.spring.fito.service.styling;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.random.RandomGenerator;

/**
 * 로컬 매칭 결과에 붙이는 코멘트 / 스타일 팁 / 상황별 조언 테이블
 *
 * 프롬프트에 포함된 키워드 그룹을 순서대로 검사하고, 처음 걸린 그룹의 문장 풀에서 하나를 고른다.
 * 문장 생성이 아니라 테이블 조회다.
 */
@Component
public class StyleNoteCatalog {

    private static final List<NoteGroup> COMMENT_GROUPS = List.of(
        new NoteGroup(List.of("date", "dinner"), List.of(
            "This look strikes the perfect balance between effort and effortlessness - you'll definitely make an impression! ✨",
            "I've put together something that says 'I care' without trying too hard. Confidence is your best accessory tonight!",
            "This combo is giving sophisticated but approachable vibes - exactly what you want for tonight! 💫"
        )),
        new NoteGroup(List.of("work", "office", "meeting", "interview"), List.of(
            "Clean, professional, and polished - you'll command the room with this look! 💼",
            "This outfit says 'I mean business' while still showing off your personal style.",
            "Power dressing at its finest - you've got this! Ready to conquer the day. ⭐"
        )),
        new NoteGroup(List.of("gym", "workout", "exercise"), List.of(
            "Functional meets fashionable - you'll look great crushing those goals! 💪",
            "Comfort and style for your workout - no excuses not to hit it hard today!",
            "Athletic chic! You'll feel as good as you look during your session. 🏋️"
        )),
        new NoteGroup(List.of("party", "night out", "club"), List.of(
            "You're going to turn heads with this look! Get ready to own the night! 🌟",
            "Statement-making and memorable - this outfit is pure main character energy!",
            "Party-ready and fabulous! The dancefloor won't know what hit it. 🎉"
        )),
        new NoteGroup(List.of("casual", "chill", "relaxed"), List.of(
            "Effortlessly cool and comfortable - the perfect laid-back look! 😎",
            "Casual doesn't mean boring - this combo keeps it stylish while keeping you comfy.",
            "Easy, breezy, and totally you - perfect for wherever the day takes you!"
        )),
        new NoteGroup(List.of("cold", "winter", "rain"), List.of(
            "Cozy meets chic! You'll stay warm without sacrificing style. ❄️",
            "Layered to perfection - this look will keep you toasty and looking great!",
            "Weather-ready and fashionable - bring on the elements! 🧥"
        )),
        new NoteGroup(List.of("summer", "hot", "beach"), List.of(
            "Light, fresh, and perfect for soaking up the sun! ☀️",
            "Summer vibes all the way - cool, comfortable, and camera-ready!",
            "This breezy look will keep you cool while looking hot! 🌴"
        ))
    );

    private static final List<String> DEFAULT_COMMENTS = List.of(
        "A versatile combination that works for wherever your day takes you! ✨",
        "I've picked pieces that complement each other beautifully - you're all set!",
        "This thoughtfully curated look balances style and practicality perfectly. 👌",
        "A winning combination! You'll feel confident and put-together all day.",
        "These pieces work so well together - sometimes the classics just hit different! 💫"
    );

    private static final List<FixedNote> TIPS = List.of(
        new FixedNote(List.of("interview", "meeting"),
            "Pro tip: Arrive 10 minutes early so you can settle in with confidence! 💼"),
        new FixedNote(List.of("date"),
            "Remember: a genuine smile is the best accessory you can wear! 💕"),
        new FixedNote(List.of("gym"),
            "Don't forget to stretch before and after - you've got this! 💪"),
        new FixedNote(List.of("cold", "winter"),
            "Layer smart: you can always take off a layer if you warm up! 🧣"),
        new FixedNote(List.of("party"),
            "Wear what makes YOU feel amazing - confidence is contagious! 🎉")
    );

    private static final List<String> DEFAULT_TIPS = List.of(
        "Confidence is your best accessory - wear it proudly! ✨",
        "When in doubt, accessories can elevate any look! 💫",
        "The right outfit can change your whole mood - own it! 🌟",
        "Style tip: make sure your shoes are clean - it's the details that count! 👟"
    );

    private static final List<FixedNote> ADVICE = List.of(
        new FixedNote(List.of("work", "office"),
            "For the office, aim for polished and professional. Neutral colors work well, and make sure everything fits properly. A blazer can elevate any outfit!"),
        new FixedNote(List.of("date"),
            "For a date, wear something that makes you feel confident. Choose an outfit that shows your personality - first impressions matter!"),
        new FixedNote(List.of("casual"),
            "For casual occasions, comfort is key. A well-fitted pair of jeans and a nice top or tee is always a winning combination."),
        new FixedNote(List.of("party", "night"),
            "For a night out, don't be afraid to make a statement! Add some color or an interesting accessory to stand out.")
    );

    private static final String DEFAULT_ADVICE =
        "Focus on comfort and confidence. Trust your instincts and accessorize to express your personal style!";

    private final RandomGenerator random;

    public StyleNoteCatalog(@Qualifier("stylistRandom") RandomGenerator random) {
        this.random = random;
    }

    public String commentFor(String prompt) {
        String lowered = lower(prompt);
        for (NoteGroup group : COMMENT_GROUPS) {
            if (group.matches(lowered)) {
                return pick(group.lines());
            }
        }
        return pick(DEFAULT_COMMENTS);
    }

    public String tipFor(String prompt) {
        String lowered = lower(prompt);
        for (FixedNote tip : TIPS) {
            if (tip.matches(lowered)) {
                return tip.text();
            }
        }
        return pick(DEFAULT_TIPS);
    }

    public String adviceFor(String occasion) {
        String lowered = lower(occasion);
        for (FixedNote advice : ADVICE) {
            if (advice.matches(lowered)) {
                return advice.text();
            }
        }
        return DEFAULT_ADVICE;
    }

    static List<String> defaultComments() {
        return DEFAULT_COMMENTS;
    }

    static List<String> defaultTips() {
        return DEFAULT_TIPS;
    }

    private String pick(List<String> pool) {
        return pool.get(random.nextInt(pool.size()));
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    private record NoteGroup(List<String> keywords, List<String> lines) {
        boolean matches(String lowered) {
            return keywords.stream().anyMatch(lowered::contains);
        }
    }

    private record FixedNote(List<String> keywords, String text) {
        boolean matches(String lowered) {
            return keywords.stream().anyMatch(lowered::contains);
        }
    }
}
