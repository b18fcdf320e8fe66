package com.spring.fito.service.styling;

import com.spring.fito.domain.outfit.AiSuggestion;
import com.spring.fito.domain.outfit.GeneratedOutfit;
import com.spring.fito.domain.wardrobe.ClothingItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.spring.fito.domain.enums.ClothingCategory.ACCESSORY;
import static com.spring.fito.domain.enums.ClothingCategory.BOTTOM;
import static com.spring.fito.domain.enums.ClothingCategory.OUTERWEAR;
import static com.spring.fito.domain.enums.ClothingCategory.SHOES;
import static com.spring.fito.domain.enums.ClothingCategory.TOP;
import static org.assertj.core.api.Assertions.assertThat;

class AiSuggestionReconcilerTest {

    private final AiSuggestionReconciler reconciler = new AiSuggestionReconciler();

    private final ClothingItem shirt = ClothingItem.of("shirt", TOP, "Formal");
    private final ClothingItem polo = ClothingItem.of("polo", TOP, "Casual");
    private final ClothingItem chinos = ClothingItem.of("chinos", BOTTOM);
    private final ClothingItem loafers = ClothingItem.of("loafers", SHOES);
    private final ClothingItem trench = ClothingItem.of("trench", OUTERWEAR);
    private final ClothingItem belt = ClothingItem.of("belt", ACCESSORY);
    private final List<ClothingItem> wardrobe = List.of(shirt, polo, chinos, loafers, trench, belt);

    @Test
    void resolvesIdsIntoSlots() {
        AiSuggestion suggestion = new AiSuggestion(List.of("shirt", "chinos", "loafers", "trench"), "why", "tip");

        GeneratedOutfit outfit = reconciler.reconcile(suggestion, wardrobe);

        assertThat(outfit.top()).isEqualTo(shirt);
        assertThat(outfit.bottom()).isEqualTo(chinos);
        assertThat(outfit.shoes()).isEqualTo(loafers);
        assertThat(outfit.outerwear()).isEqualTo(trench);
        assertThat(outfit.matchedKeywords()).isEmpty();
    }

    @Test
    void firstIdPerSlotWins() {
        AiSuggestion suggestion = new AiSuggestion(List.of("polo", "shirt", "chinos"), "why", "tip");

        GeneratedOutfit outfit = reconciler.reconcile(suggestion, wardrobe);

        assertThat(outfit.top()).isEqualTo(polo);
        assertThat(outfit.items()).containsExactly(polo, chinos);
    }

    @Test
    void dropsAccessoriesAndUnknownIds() {
        AiSuggestion suggestion = new AiSuggestion(List.of("belt", "ghost", "loafers"), "why", "tip");

        GeneratedOutfit outfit = reconciler.reconcile(suggestion, wardrobe);

        assertThat(outfit.items()).containsExactly(loafers);
        assertThat(outfit.isValid()).isTrue();
    }

    @Test
    void onlyOuterwearIsNotValid() {
        GeneratedOutfit outfit = reconciler.reconcile(new AiSuggestion(List.of("trench"), "why", "tip"), wardrobe);

        assertThat(outfit.outerwear()).isEqualTo(trench);
        assertThat(outfit.isValid()).isFalse();
    }

    @Test
    void emptyOrMissingSuggestionGivesEmptyOutfit() {
        assertThat(reconciler.reconcile(new AiSuggestion(null, null, null), wardrobe).isEmpty()).isTrue();
        assertThat(reconciler.reconcile(null, wardrobe).isEmpty()).isTrue();
    }
}
