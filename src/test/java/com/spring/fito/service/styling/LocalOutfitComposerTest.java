package com.spring.fito.service.styling;

import com.spring.fito.domain.outfit.GeneratedOutfit;
import com.spring.fito.domain.wardrobe.ClothingItem;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.spring.fito.domain.enums.ClothingCategory.ACCESSORY;
import static com.spring.fito.domain.enums.ClothingCategory.BOTTOM;
import static com.spring.fito.domain.enums.ClothingCategory.OUTERWEAR;
import static com.spring.fito.domain.enums.ClothingCategory.SHOES;
import static com.spring.fito.domain.enums.ClothingCategory.TOP;
import static org.assertj.core.api.Assertions.assertThat;

class LocalOutfitComposerTest {

    private static LocalOutfitComposer composer(long seed) {
        return new LocalOutfitComposer(new TagLexicon(), new CategoryMatcher(new Random(seed)));
    }

    @Test
    void interviewPromptPicksByTagsAndFallsBackForShoes() {
        ClothingItem top = ClothingItem.of("top", TOP, "Formal", "Business");
        ClothingItem bottom = ClothingItem.of("bottom", BOTTOM, "Formal");
        ClothingItem shoes = ClothingItem.of("shoes", SHOES, "Casual");

        GeneratedOutfit outfit = composer(1).compose("Job interview today", List.of(top, bottom, shoes));

        assertThat(outfit.top()).isEqualTo(top);
        assertThat(outfit.bottom()).isEqualTo(bottom);
        assertThat(outfit.shoes()).isEqualTo(shoes);
        assertThat(outfit.outerwear()).isNull();
        assertThat(outfit.matchedKeywords()).containsExactly("interview");
        assertThat(outfit.isValid()).isTrue();
    }

    @Test
    void outerwearOnlyWhenWeatherCallsForIt() {
        List<ClothingItem> wardrobe = List.of(
            ClothingItem.of("tee", TOP, "Casual"),
            ClothingItem.of("jeans", BOTTOM, "Casual", "Denim"),
            ClothingItem.of("sneakers", SHOES, "Casual"),
            ClothingItem.of("parka", OUTERWEAR, "All-Season", "Outerwear")
        );

        GeneratedOutfit rainy = composer(3).compose("Rainy day walk", wardrobe);
        GeneratedOutfit coffee = composer(3).compose("Casual coffee date", wardrobe);

        assertThat(rainy.outerwear()).isNotNull();
        assertThat(rainy.outerwear().id()).isEqualTo("parka");
        assertThat(coffee.outerwear()).isNull();
        assertThat(coffee.items()).extracting(ClothingItem::id).containsExactly("tee", "jeans", "sneakers");
    }

    @Test
    void accessoriesNeverEnterTheOutfit() {
        List<ClothingItem> wardrobe = List.of(
            ClothingItem.of("watch", ACCESSORY, "Formal"),
            ClothingItem.of("shirt", TOP, "Formal")
        );

        GeneratedOutfit outfit = composer(5).compose("formal dinner", wardrobe);

        assertThat(outfit.items()).extracting(ClothingItem::id).containsExactly("shirt");
    }

    @Test
    void outerwearAloneIsNotAValidOutfit() {
        List<ClothingItem> wardrobe = List.of(
            ClothingItem.of("coat", OUTERWEAR, "Winter"),
            ClothingItem.of("scarf", ACCESSORY, "Winter")
        );

        GeneratedOutfit outfit = composer(9).compose("Cold winter morning", wardrobe);

        assertThat(outfit.outerwear()).isNotNull();
        assertThat(outfit.isValid()).isFalse();
    }

    @Test
    void sameSeedSamePromptSameOutfit() {
        List<ClothingItem> wardrobe = List.of(
            ClothingItem.of("t1", TOP, "Casual"),
            ClothingItem.of("t2", TOP, "Casual"),
            ClothingItem.of("t3", TOP, "Formal"),
            ClothingItem.of("b1", BOTTOM, "Denim"),
            ClothingItem.of("b2", BOTTOM, "Linen"),
            ClothingItem.of("s1", SHOES),
            ClothingItem.of("s2", SHOES)
        );

        GeneratedOutfit first = composer(11).compose("relaxed weekend", wardrobe);
        GeneratedOutfit second = composer(11).compose("relaxed weekend", wardrobe);

        assertThat(first).isEqualTo(second);
    }
}
