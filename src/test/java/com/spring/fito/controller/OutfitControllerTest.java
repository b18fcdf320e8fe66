package com.spring.fito.controller;

import com.spring.fito.config.JwtProperties;
import com.spring.fito.domain.enums.GenerationSource;
import com.spring.fito.domain.enums.GenerationStatus;
import com.spring.fito.domain.enums.SubscriptionTier;
import com.spring.fito.domain.outfit.GeneratedOutfit;
import com.spring.fito.domain.wardrobe.ClothingItem;
import com.spring.fito.dto.outfit.GenerateOutfitRequest;
import com.spring.fito.dto.outfit.GenerateOutfitResponse;
import com.spring.fito.dto.outfit.GenerationStatusResponse;
import com.spring.fito.exception.BadRequestException;
import com.spring.fito.exception.ErrorCode;
import com.spring.fito.exception.GlobalExceptionHandler;
import com.spring.fito.exception.QuotaExceededException;
import com.spring.fito.security.StylistIdentity;
import com.spring.fito.security.StylistIdentityResolver;
import com.spring.fito.service.StylistService;
import com.spring.fito.service.generation.GenerationSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.spring.fito.domain.enums.ClothingCategory.BOTTOM;
import static com.spring.fito.domain.enums.ClothingCategory.SHOES;
import static com.spring.fito.domain.enums.ClothingCategory.TOP;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OutfitControllerTest {

    private static final String BODY = """
        {"prompt": "Job interview today",
         "wardrobe": [
           {"id": "t1", "category": "top", "tags": ["Formal"]},
           {"id": "b1", "category": "Bottom", "tags": []},
           {"id": "s1", "category": "SHOES"}
         ]}
        """;

    @Mock
    private StylistService stylistService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        StylistIdentityResolver resolver = new StylistIdentityResolver(new JwtProperties("c2VjcmV0", "tier"));
        mockMvc = MockMvcBuilders.standaloneSetup(new OutfitController(stylistService, resolver))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    private static JwtAuthenticationToken member(String subject) {
        Jwt jwt = Jwt.withTokenValue("token").header("alg", "HS256").subject(subject).claim("tier", "FREE").build();
        return new JwtAuthenticationToken(jwt, List.of());
    }

    @Test
    void guestGenerationReturnsOutfit() throws Exception {
        GeneratedOutfit outfit = new GeneratedOutfit(
            ClothingItem.of("t1", TOP, "Formal"), ClothingItem.of("b1", BOTTOM), ClothingItem.of("s1", SHOES),
            null, List.of("interview"));
        when(stylistService.generate(any(StylistIdentity.class), any(GenerateOutfitRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(new GenerateOutfitResponse(
                1L, GenerationStatus.SUCCESS, GenerationSource.LOCAL, outfit, "Looks sharp", "Smile", null)));

        MvcResult started = mockMvc.perform(post("/api/v1/outfits/generate")
                .header(StylistIdentityResolver.CLIENT_ID_HEADER, "device-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(started))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("SUCCESS"))
            .andExpect(jsonPath("$.source").value("LOCAL"))
            .andExpect(jsonPath("$.outfit.top.category").value("Top"))
            .andExpect(jsonPath("$.outfit.valid").value(true))
            .andExpect(jsonPath("$.outfit.items.length()").value(3))
            .andExpect(jsonPath("$.outfit.matchedKeywords[0]").value("interview"));

        ArgumentCaptor<StylistIdentity> identity = ArgumentCaptor.forClass(StylistIdentity.class);
        ArgumentCaptor<GenerateOutfitRequest> request = ArgumentCaptor.forClass(GenerateOutfitRequest.class);
        verify(stylistService).generate(identity.capture(), request.capture());
        assertThat(identity.getValue().owner()).isEqualTo("guest:device-1");
        assertThat(request.getValue().wardrobeItems()).extracting(ClothingItem::category)
            .containsExactly(TOP, BOTTOM, SHOES);
    }

    @Test
    void failedGenerationIsMappedByExceptionHandler() throws Exception {
        when(stylistService.generate(any(StylistIdentity.class), any(GenerateOutfitRequest.class)))
            .thenReturn(CompletableFuture.failedFuture(
                new QuotaExceededException("You've used all your free generations this month")));

        MvcResult started = mockMvc.perform(post("/api/v1/outfits/generate")
                .principal(member("user-1"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(started))
            .andExpect(status().isPaymentRequired())
            .andExpect(jsonPath("$.upgradeOffer").value(true));
    }

    @Test
    void emptyPromptSurfacesAsBadRequest() throws Exception {
        when(stylistService.generate(any(StylistIdentity.class), any(GenerateOutfitRequest.class)))
            .thenReturn(CompletableFuture.failedFuture(
                new BadRequestException(ErrorCode.EMPTY_PROMPT, "Please enter what you're doing today!")));

        MvcResult started = mockMvc.perform(post("/api/v1/outfits/generate")
                .header(StylistIdentityResolver.CLIENT_ID_HEADER, "device-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\": \"\", \"wardrobe\": []}"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(started))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("EMPTY_PROMPT"));
    }

    @Test
    void overlongPromptFailsValidation() throws Exception {
        String body = "{\"prompt\": \"" + "a".repeat(501) + "\", \"wardrobe\": []}";

        mockMvc.perform(post("/api/v1/outfits/generate")
                .header(StylistIdentityResolver.CLIENT_ID_HEADER, "device-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

        verifyNoInteractions(stylistService);
    }

    @Test
    void unknownCategoryIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/outfits/generate")
                .header(StylistIdentityResolver.CLIENT_ID_HEADER, "device-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"prompt\": \"gym\", \"wardrobe\": [{\"id\": \"x\", \"category\": \"hat\"}]}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(stylistService);
    }

    @Test
    void guestWithoutClientIdIsRejected() throws Exception {
        mockMvc.perform(get("/api/v1/outfits/status"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void statusAndResetUseCallerSession() throws Exception {
        when(stylistService.status(eq(StylistIdentity.guest("device-1"))))
            .thenReturn(GenerationStatusResponse.from(GenerationSnapshot.idle()));

        mockMvc.perform(get("/api/v1/outfits/status").header(StylistIdentityResolver.CLIENT_ID_HEADER, "device-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.phase").value("IDLE"))
            .andExpect(jsonPath("$.generating").value(false));

        mockMvc.perform(delete("/api/v1/outfits/session").principal(member("user-1")))
            .andExpect(status().isNoContent());

        verify(stylistService).reset(eq(StylistIdentity.member("user-1", SubscriptionTier.FREE)));
    }
}
