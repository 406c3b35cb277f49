package com.selectra.scorecard.dto;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FinalReportRequestDto {
    private String sessionId;
    private InterviewerDto interviewer;
}
