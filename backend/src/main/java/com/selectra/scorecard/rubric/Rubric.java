package com.selectra.scorecard.rubric;

import com.selectra.scorecard.model.QuestionSpec;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Declarative scoring data: the question bank and the phrase tables the
 * signal extractor looks for. Nothing in here is interpreted as logic.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Rubric {
    List<QuestionSpec> questions;
    List<String> fillerPhrases;
    List<String> assertivePhrases;
    List<String> examplePhrases;
}
