package com.spring.fito.controller;

import com.spring.fito.dto.outfit.GenerateOutfitRequest;
import com.spring.fito.dto.outfit.GenerateOutfitResponse;
import com.spring.fito.dto.outfit.GenerationStatusResponse;
import com.spring.fito.security.StylistIdentityResolver;
import com.spring.fito.service.StylistService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;

/**
 * 코디 생성 API 컨트롤러
 * - 게스트는 X-Client-Id 헤더로 세션을 구분한다
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/outfits")
public class OutfitController {

    private final StylistService stylistService;
    private final StylistIdentityResolver identityResolver;

    /**
     * 코디 생성 (AI 경로는 비동기로 응답)
     */
    @PostMapping("/generate")
    public CompletableFuture<GenerateOutfitResponse> generate(
        @RequestBody @Valid GenerateOutfitRequest request,
        @RequestHeader(value = StylistIdentityResolver.CLIENT_ID_HEADER, required = false) String clientId,
        Authentication authentication
    ) {
        return stylistService.generate(identityResolver.resolve(authentication, clientId), request);
    }

    @GetMapping("/status")
    public GenerationStatusResponse status(
        @RequestHeader(value = StylistIdentityResolver.CLIENT_ID_HEADER, required = false) String clientId,
        Authentication authentication
    ) {
        return stylistService.status(identityResolver.resolve(authentication, clientId));
    }

    @DeleteMapping("/session")
    public ResponseEntity<Void> reset(
        @RequestHeader(value = StylistIdentityResolver.CLIENT_ID_HEADER, required = false) String clientId,
        Authentication authentication
    ) {
        stylistService.reset(identityResolver.resolve(authentication, clientId));
        return ResponseEntity.noContent().build();
    }
}
