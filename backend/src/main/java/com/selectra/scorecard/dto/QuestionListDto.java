package com.selectra.scorecard.dto;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuestionListDto {
    private List<QuestionResponseDto> questions;
    private Integer total;
}
