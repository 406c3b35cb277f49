package com.selectra.scorecard.dto;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateRequestDto {
    private String sessionId;
    private Integer questionId;
    private String answer;
}
