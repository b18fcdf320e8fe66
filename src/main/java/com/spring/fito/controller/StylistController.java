package com.spring.fito.controller;

import com.spring.fito.dto.stylist.QuotaResponse;
import com.spring.fito.dto.stylist.StyleAdviceResponse;
import com.spring.fito.dto.stylist.VocabularyResponse;
import com.spring.fito.security.StylistIdentityResolver;
import com.spring.fito.service.StylistService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 스타일리스트 부가 API 컨트롤러
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/stylist")
public class StylistController {

    private final StylistService stylistService;
    private final StylistIdentityResolver identityResolver;

    @GetMapping("/vocabulary")
    public VocabularyResponse vocabulary() {
        return stylistService.vocabulary();
    }

    @GetMapping("/quota")
    public QuotaResponse quota(Authentication authentication) {
        return stylistService.quota(identityResolver.requireMember(authentication));
    }

    @GetMapping("/advice")
    public StyleAdviceResponse advice(@RequestParam String occasion, Authentication authentication) {
        identityResolver.requireMember(authentication);
        return stylistService.advice(occasion);
    }
}
