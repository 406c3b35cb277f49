package com.selectra.scorecard.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class QuestionSpec {
    int id;
    String text;
    String category;
    List<String> keywords;
}
