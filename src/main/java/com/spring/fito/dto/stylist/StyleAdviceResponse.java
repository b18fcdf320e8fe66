package com.spring.fito.dto.stylist;

/**
 * 상황별 스타일 조언 응답 DTO
 */
public record StyleAdviceResponse(
    String occasion,
    String advice
) {}
