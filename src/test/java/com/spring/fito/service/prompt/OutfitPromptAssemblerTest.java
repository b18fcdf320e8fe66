package com.spring.fito.service.prompt;

import com.spring.fito.domain.wardrobe.ClothingItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.spring.fito.domain.enums.ClothingCategory.ACCESSORY;
import static com.spring.fito.domain.enums.ClothingCategory.BOTTOM;
import static com.spring.fito.domain.enums.ClothingCategory.TOP;
import static org.assertj.core.api.Assertions.assertThat;

class OutfitPromptAssemblerTest {

    private final OutfitPromptAssembler assembler = new OutfitPromptAssembler();

    @Test
    void groupsItemsByCategoryAndMarksEmptySections() {
        String prompt = assembler.assembleUserPrompt("Beach day", List.of(
            ClothingItem.of("a", TOP, "Summer", "Linen"),
            ClothingItem.of("b", TOP),
            ClothingItem.of("c", BOTTOM, "Denim"),
            ClothingItem.of("d", ACCESSORY, "Gold")
        ), null);

        assertThat(prompt).contains("Select the best outfit for: \"Beach day\"");
        assertThat(prompt).contains("TOPS:\n  1. ID: \"a\" - Tags: [Summer, Linen]\n  2. ID: \"b\" - Tags: [none]");
        assertThat(prompt).contains("BOTTOMS:\n  1. ID: \"c\" - Tags: [Denim]");
        assertThat(prompt).contains("SHOES:\n  (none available)");
        assertThat(prompt).doesNotContain("\"d\"");
        assertThat(prompt).contains("\"style_tip\"");
    }

    @Test
    void includesPersonalStyleWhenGiven() {
        String prompt = assembler.assembleUserPrompt("Brunch", List.of(), "minimalist");

        assertThat(prompt).contains("personal style as: \"minimalist\"");
    }
}
