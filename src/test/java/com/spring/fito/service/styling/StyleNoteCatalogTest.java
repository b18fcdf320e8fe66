package com.spring.fito.service.styling;

import org.junit.jupiter.api.Test;

import java.util.random.RandomGenerator;

import static org.assertj.core.api.Assertions.assertThat;

class StyleNoteCatalogTest {

    /** 항상 풀의 첫 문장을 고르는 난수원 */
    private final RandomGenerator firstPick = () -> 0L;

    private final StyleNoteCatalog catalog = new StyleNoteCatalog(firstPick);

    @Test
    void commentFollowsFirstMatchingGroup() {
        assertThat(catalog.commentFor("Dinner date with Sam"))
            .startsWith("This look strikes the perfect balance");
        // work group is checked before gym
        assertThat(catalog.commentFor("Office gym session"))
            .startsWith("Clean, professional, and polished");
        assertThat(catalog.commentFor("Night out downtown"))
            .startsWith("You're going to turn heads");
    }

    @Test
    void commentFallsBackToDefaultPool() {
        assertThat(catalog.commentFor("Picnic")).isIn(StyleNoteCatalog.defaultComments());
    }

    @Test
    void tipsAreFixedPerOccasion() {
        assertThat(catalog.tipFor("Big meeting")).startsWith("Pro tip: Arrive 10 minutes early");
        assertThat(catalog.tipFor("interview then date")).startsWith("Pro tip: Arrive 10 minutes early");
        assertThat(catalog.tipFor("Date night")).startsWith("Remember: a genuine smile");
        assertThat(catalog.tipFor("cold walk")).startsWith("Layer smart");
        assertThat(catalog.tipFor("museum")).isIn(StyleNoteCatalog.defaultTips());
    }

    @Test
    void adviceForOccasion() {
        assertThat(catalog.adviceFor("Office party")).startsWith("For the office");
        assertThat(catalog.adviceFor("NIGHT at the opera")).startsWith("For a night out");
        assertThat(catalog.adviceFor("anything")).startsWith("Focus on comfort and confidence");
    }
}
