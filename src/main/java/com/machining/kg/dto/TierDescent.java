package com.machining.kg.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Why a fallback tier did not produce the answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TierDescent {
    private int tier;
    private String tierName;
    private String reason;
}
